package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.veraaws.services.ec2.Ec2Fixture.items;
import static io.veraaws.services.ec2.Ec2Fixture.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VpcHandlerTest {

    private final Ec2Fixture ec2 = new Ec2Fixture();

    @Test
    void createRendersVpcWithAssociationAndDefaultGroup() {
        ValueTree.Mapping vpc = ec2.call("CreateVpc", "CidrBlock", "10.0.0.0/16",
                "TagSpecification.1.ResourceType", "vpc",
                "TagSpecification.1.Tag.1.Key", "Name",
                "TagSpecification.1.Tag.1.Value", "main").mapping("vpc").orElseThrow();

        assertThat(vpc.text("vpcId")).hasValueSatisfying(id -> assertThat(id).matches("vpc-[0-9a-f]{17}"));
        assertThat(vpc.text("state")).contains("available");
        assertThat(vpc.text("cidrBlock")).contains("10.0.0.0/16");
        assertThat(vpc.text("isDefault")).contains("false");
        assertThat(items(vpc, "cidrBlockAssociationSet")).singleElement()
                .satisfies(a -> assertThat(text(a, "cidrBlockState", "state")).isEqualTo("associated"));
        assertThat(items(vpc, "tagSet")).singleElement()
                .satisfies(t -> assertThat(t.text("value")).contains("main"));

        String vpcId = vpc.text("vpcId").orElseThrow();
        ValueTree.Mapping groups = ec2.call("DescribeSecurityGroups",
                "Filter.1.Name", "vpc-id", "Filter.1.Value.1", vpcId);
        assertThat(items(groups, "securityGroupInfo")).singleElement()
                .satisfies(g -> assertThat(g.text("groupName")).contains("default"));
    }

    @Test
    void prefixOutsideSixteenToTwentyEightIsRejected() {
        for (String cidr : List.of("10.0.0.0/8", "10.0.0.0/29")) {
            assertThatThrownBy(() -> ec2.call("CreateVpc", "CidrBlock", cidr))
                    .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidVpc.Range"));
        }
        assertThatThrownBy(() -> ec2.call("CreateVpc", "CidrBlock", "10.0.0.1/16"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
        assertThatThrownBy(() -> ec2.call("CreateVpc"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("MissingParameter"));
    }

    @Test
    void describeByIdAndFilter() {
        String a = ec2.createVpc("10.0.0.0/16");
        String b = ec2.createVpc("10.1.0.0/16");

        assertThat(items(ec2.call("DescribeVpcs", "VpcId.1", b), "vpcSet"))
                .extracting(v -> v.text("vpcId").orElseThrow()).containsExactly(b);
        assertThat(items(ec2.call("DescribeVpcs", "Filter.1.Name", "cidr-block", "Filter.1.Value.1", "10.0.*"), "vpcSet"))
                .extracting(v -> v.text("vpcId").orElseThrow()).containsExactly(a);
        assertThat(items(ec2.call("DescribeVpcs"), "vpcSet")).hasSize(2);
    }

    @Test
    void describingAMissingIdFailsWithNotFound() {
        assertThatThrownBy(() -> ec2.call("DescribeVpcs", "VpcId.1", "vpc-00000000000000000"))
                .isInstanceOfSatisfying(AwsException.NotFound.class,
                        e -> assertThat(e.errorCode()).isEqualTo("InvalidVpcID.NotFound"));
    }

    @Test
    void deleteTakesTheDefaultGroupAlong() {
        String vpcId = ec2.createVpc("10.0.0.0/16");

        ec2.call("DeleteVpc", "VpcId", vpcId);

        assertThat(items(ec2.call("DescribeVpcs"), "vpcSet")).isEmpty();
        assertThat(items(ec2.call("DescribeSecurityGroups"), "securityGroupInfo")).isEmpty();
    }

    @Test
    void deleteIsBlockedBySubnetsAndCustomGroups() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        String subnetId = ec2.createSubnet(vpcId, "10.0.1.0/24");

        assertThatThrownBy(() -> ec2.call("DeleteVpc", "VpcId", vpcId)).isInstanceOf(AwsException.DependencyViolation.class);

        ec2.call("DeleteSubnet", "SubnetId", subnetId);
        String groupId = ec2.createGroup(vpcId, "web");
        assertThatThrownBy(() -> ec2.call("DeleteVpc", "VpcId", vpcId)).isInstanceOf(AwsException.DependencyViolation.class);

        ec2.call("DeleteSecurityGroup", "GroupId", groupId);
        ec2.call("DeleteVpc", "VpcId", vpcId);
        assertThat(ec2.store.find(Ec2ResourceTypes.VPC, vpcId)).isEmpty();
    }

    @Test
    void storeDeleteOnlyCascadesToTheDefaultGroup() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        String groupId = ec2.createGroup(vpcId, "web");

        assertThatThrownBy(() -> ec2.store.delete(Ec2ResourceTypes.VPC, vpcId))
                .isInstanceOf(AwsException.DependencyViolation.class);
        assertThatThrownBy(() -> ec2.call("DeleteVpc", "VpcId", vpcId))
                .isInstanceOf(AwsException.DependencyViolation.class);

        assertThat(ec2.store.find(Ec2ResourceTypes.VPC, vpcId)).isPresent();
        assertThat(ec2.store.find(Ec2ResourceTypes.SECURITY_GROUP, groupId)).isPresent();
        assertThat(items(ec2.call("DescribeSecurityGroups", "Filter.1.Name", "vpc-id", "Filter.1.Value.1", vpcId),
                "securityGroupInfo")).hasSize(2);
    }

    @Test
    void dryRunCreatesNothing() {
        assertThatThrownBy(() -> ec2.call("CreateVpc", "CidrBlock", "10.0.0.0/16", "DryRun", "true"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.httpStatus()).isEqualTo(412));
        assertThat(ec2.store.list(Ec2ResourceTypes.VPC)).isEmpty();
    }

    @Test
    void secondDefaultVpcIsRejected() {
        ValueTree.Mapping vpc = ec2.call("CreateDefaultVpc").mapping("vpc").orElseThrow();

        assertThat(vpc.text("isDefault")).contains("true");
        assertThat(vpc.text("cidrBlock")).contains("172.31.0.0/16");
        assertThatThrownBy(() -> ec2.call("CreateDefaultVpc"))
                .isInstanceOfSatisfying(AwsException.class,
                        e -> assertThat(e.errorCode()).isEqualTo("DefaultVpcAlreadyExists"));
    }
}
