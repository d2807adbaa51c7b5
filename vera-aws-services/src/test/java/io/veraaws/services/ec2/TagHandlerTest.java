package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.veraaws.services.ec2.Ec2Fixture.items;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagHandlerTest {

    private final Ec2Fixture ec2 = new Ec2Fixture();

    private Map<String, String> tagsOf(String id) {
        return ec2.store.lookup(id).orElseThrow().tags();
    }

    @Test
    void createTagsSpansResourceTypes() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        String subnetId = ec2.createSubnet(vpcId, "10.0.1.0/24");

        ec2.call("CreateTags", "ResourceId.1", vpcId, "ResourceId.2", subnetId,
                "Tag.1.Key", "env", "Tag.1.Value", "prod");

        assertThat(tagsOf(vpcId)).containsEntry("env", "prod");
        assertThat(tagsOf(subnetId)).containsEntry("env", "prod");
        assertThat(items(ec2.call("DescribeSubnets", "Filter.1.Name", "tag:env", "Filter.1.Value.1", "prod"), "subnetSet"))
                .hasSize(1);
    }

    @Test
    void missingResourceFailsBeforeAnyTagIsApplied() {
        String vpcId = ec2.createVpc("10.0.0.0/16");

        assertThatThrownBy(() -> ec2.call("CreateTags", "ResourceId.1", vpcId, "ResourceId.2", "subnet-00000000000000000",
                "Tag.1.Key", "env", "Tag.1.Value", "prod"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidSubnetID.NotFound"));
        assertThat(tagsOf(vpcId)).isEmpty();

        assertThatThrownBy(() -> ec2.call("CreateTags", "ResourceId.1", "foo-1234", "Tag.1.Key", "k"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidID"));
    }

    @Test
    void deleteTagsHonorsValues() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        ec2.call("CreateTags", "ResourceId.1", vpcId,
                "Tag.1.Key", "env", "Tag.1.Value", "prod",
                "Tag.2.Key", "team", "Tag.2.Value", "core",
                "Tag.3.Key", "Name", "Tag.3.Value", "main");

        ec2.call("DeleteTags", "ResourceId.1", vpcId, "Tag.1.Key", "env", "Tag.1.Value", "staging");
        assertThat(tagsOf(vpcId)).containsKey("env");

        ec2.call("DeleteTags", "ResourceId.1", vpcId, "Tag.1.Key", "env", "Tag.2.Key", "team", "Tag.2.Value", "core");
        assertThat(tagsOf(vpcId)).containsOnlyKeys("Name");

        ec2.call("DeleteTags", "ResourceId.1", vpcId);
        assertThat(tagsOf(vpcId)).isEmpty();
    }

    @Test
    void describeTagsListsOneRowPerTag() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        String igw = Ec2Fixture.text(ec2.call("CreateInternetGateway",
                "TagSpecification.1.ResourceType", "internet-gateway",
                "TagSpecification.1.Tag.1.Key", "Name",
                "TagSpecification.1.Tag.1.Value", "edge"), "internetGateway", "internetGatewayId");
        ec2.call("CreateTags", "ResourceId.1", vpcId, "Tag.1.Key", "Name", "Tag.1.Value", "main",
                "Tag.2.Key", "env", "Tag.2.Value", "prod");

        List<ValueTree.Mapping> all = items(ec2.call("DescribeTags"), "tagSet");
        assertThat(all).hasSize(3);

        List<ValueTree.Mapping> gateways = items(ec2.call("DescribeTags",
                "Filter.1.Name", "resource-type", "Filter.1.Value.1", "internet-gateway"), "tagSet");
        assertThat(gateways).singleElement().satisfies(row -> {
            assertThat(row.text("resourceId")).contains(igw);
            assertThat(row.text("key")).contains("Name");
            assertThat(row.text("value")).contains("edge");
        });

        ValueTree.Mapping page = ec2.call("DescribeTags", "Filter.1.Name", "key", "Filter.1.Value.1", "Name", "MaxResults", "1");
        assertThat(items(page, "tagSet")).hasSize(1);
        assertThat(page.text("nextToken")).isPresent();
    }
}
