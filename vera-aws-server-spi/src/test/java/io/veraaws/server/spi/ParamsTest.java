package io.veraaws.server.spi;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParamsTest {

    private static ValueTree.Mapping filter(String name, String... values) {
        return ValueTree.Mapping.builder()
                .put("Name", name)
                .put("Value", ValueTree.Sequence.ofTexts(List.of(values)))
                .build();
    }

    private static ValueTree.Mapping tag(String key, String value) {
        return ValueTree.Mapping.builder().put("Key", key).put("Value", value).build();
    }

    @Test
    void requireReportsMissingParameter() {
        assertThatThrownBy(() -> Params.require(ValueTree.Mapping.empty(), "CidrBlock"))
                .isInstanceOfSatisfying(AwsException.MalformedParameter.class,
                        e -> assertThat(e.errorCode()).isEqualTo("MissingParameter"));
    }

    @Test
    void textRejectsStructuredValue() {
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("VpcId", ValueTree.Sequence.ofTexts(List.of("vpc-1")))
                .build();
        assertThatThrownBy(() -> Params.text(params, "VpcId"))
                .isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void flagAndIntegerValidateTheirInput() {
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("DryRun", "TRUE")
                .put("MaxCount", "3")
                .put("MinCount", "three")
                .build();

        assertThat(Params.flag(params, "DryRun")).isTrue();
        assertThat(Params.flag(params, "Absent")).isFalse();
        assertThat(Params.integer(params, "MaxCount")).contains(3);
        assertThatThrownBy(() -> Params.integer(params, "MinCount"))
                .isInstanceOf(AwsException.MalformedParameter.class)
                .hasMessageContaining("three");
    }

    @Test
    void textsTreatsSingleValueAsOneElementList() {
        ValueTree.Mapping params = ValueTree.Mapping.builder().put("VpcId", "vpc-1").build();
        assertThat(Params.texts(params, "VpcId")).containsExactly("vpc-1");
        assertThat(Params.texts(params, "SubnetId")).isEmpty();
    }

    @Test
    void filtersReadNamesAndValues() {
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("Filter", ValueTree.Sequence.of(filter("instance-type", "t2.micro", "t3.micro"), filter("tag:env", "prod")))
                .build();

        assertThat(Params.filters(params)).containsExactly(
                new FilterSpec("instance-type", List.of("t2.micro", "t3.micro")),
                new FilterSpec("tag:env", List.of("prod")));
    }

    @Test
    void filterWithoutNameIsMissingParameter() {
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("Filter", ValueTree.Sequence.of(ValueTree.Mapping.builder().put("Value", "x").build()))
                .build();
        assertThatThrownBy(() -> Params.filters(params))
                .isInstanceOf(AwsException.MalformedParameter.class)
                .hasMessageContaining("Filter.1.Name");
    }

    @Test
    void tagsKeepLastValueForRepeatedKey() {
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("Tag", ValueTree.Sequence.of(tag("env", "dev"), tag("team", "core"), tag("env", "prod")))
                .build();
        assertThat(Params.tags(params, "Tag")).containsExactly(Map.entry("env", "prod"), Map.entry("team", "core"));
    }

    @Test
    void tagSpecificationsSelectMatchingResourceType() {
        ValueTree.Mapping forVpc = ValueTree.Mapping.builder()
                .put("ResourceType", "vpc")
                .put("Tag", ValueTree.Sequence.of(tag("Name", "main")))
                .build();
        ValueTree.Mapping forSubnet = ValueTree.Mapping.builder()
                .put("ResourceType", "subnet")
                .put("Tag", ValueTree.Sequence.of(tag("Name", "other")))
                .build();
        ValueTree.Mapping params = ValueTree.Mapping.builder()
                .put("TagSpecification", ValueTree.Sequence.of(forVpc, forSubnet))
                .build();

        assertThat(Params.tagSpecifications(params, "vpc")).containsExactly(Map.entry("Name", "main"));
        assertThat(Params.tagSpecifications(params, "volume")).isEmpty();
    }

    @Test
    void dryRunRaisesDryRunOperation() {
        ValueTree.Mapping params = ValueTree.Mapping.builder().put("DryRun", "true").build();
        assertThatThrownBy(() -> Params.checkDryRun(params))
                .isInstanceOfSatisfying(AwsException.DryRunOperation.class,
                        e -> assertThat(e.httpStatus()).isEqualTo(412));
        Params.checkDryRun(ValueTree.Mapping.empty());
    }
}
