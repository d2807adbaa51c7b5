package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CidrTest {

    @Test
    void parsesAndFormats() {
        Cidr cidr = Cidr.parse("CidrBlock", "10.0.0.0/16");

        assertThat(cidr.prefix()).isEqualTo(16);
        assertThat(cidr.size()).isEqualTo(65536);
        assertThat(cidr.toString()).isEqualTo("10.0.0.0/16");
        assertThat(cidr.address(4)).isEqualTo("10.0.0.4");
        assertThat(cidr.address(256)).isEqualTo("10.0.1.0");
    }

    @Test
    void rejectsMalformedAndMisalignedBlocks() {
        for (String bad : new String[]{"10.0.0.0", "10.0.0/16", "10.0.0.256/24", "10.0.0.0/33", "10.0.0.1/24", "a.b.c.d/8", "10.0.0.0/x"}) {
            assertThatThrownBy(() -> Cidr.parse("CidrBlock", bad))
                    .as(bad)
                    .isInstanceOfSatisfying(AwsException.class, e -> {
                        assertThat(e.errorCode()).isEqualTo("InvalidParameterValue");
                        assertThat(e.getMessage()).contains(bad);
                    });
        }
    }

    @Test
    void containmentAndOverlap() {
        Cidr vpc = Cidr.parse("c", "10.0.0.0/16");
        Cidr a = Cidr.parse("c", "10.0.0.0/20");
        Cidr b = Cidr.parse("c", "10.0.1.0/24");
        Cidr c = Cidr.parse("c", "10.0.16.0/24");

        assertThat(vpc.contains(a)).isTrue();
        assertThat(a.contains(vpc)).isFalse();
        assertThat(a.overlaps(b)).isTrue();
        assertThat(b.overlaps(a)).isTrue();
        assertThat(a.overlaps(c)).isFalse();
        assertThat(Cidr.parse("c", "0.0.0.0/0").contains(c)).isTrue();
    }
}
