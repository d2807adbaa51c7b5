package io.veraaws.services.ec2;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RegionCatalogTest {

    @Test
    void zoneIdsUseTheShortRegionCode() {
        assertThat(RegionCatalog.zoneIdPrefix("us-east-1")).isEqualTo("use1");
        assertThat(RegionCatalog.zoneIdPrefix("ap-southeast-2")).isEqualTo("apse2");
        assertThat(RegionCatalog.zoneIdPrefix("eu-central-1")).isEqualTo("euc1");
        assertThat(RegionCatalog.zoneId("eu-west-1", "eu-west-1c")).isEqualTo("euw1-az3");
    }

    @Test
    void everyRegionHasThreeZones() {
        for (String region : RegionCatalog.REGIONS) {
            assertThat(RegionCatalog.zones(region)).hasSize(3)
                    .allSatisfy(z -> assertThat(z.name()).startsWith(region));
        }
        assertThat(RegionCatalog.isZone("us-east-1", "us-east-1c")).isTrue();
        assertThat(RegionCatalog.isZone("us-east-1", "us-east-1d")).isFalse();
    }
}
