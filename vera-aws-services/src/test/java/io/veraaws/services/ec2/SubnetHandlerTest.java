package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import static io.veraaws.services.ec2.Ec2Fixture.items;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubnetHandlerTest {

    private final Ec2Fixture ec2 = new Ec2Fixture();

    @Test
    void createDefaultsToFirstZoneAndCountsAddresses() {
        String vpcId = ec2.createVpc("10.0.0.0/16");

        ValueTree.Mapping subnet = ec2.call("CreateSubnet", "VpcId", vpcId, "CidrBlock", "10.0.1.0/24")
                .mapping("subnet").orElseThrow();

        assertThat(subnet.text("availabilityZone")).contains("us-east-1a");
        assertThat(subnet.text("availabilityZoneId")).contains("use1-az1");
        assertThat(subnet.text("availableIpAddressCount")).contains("251");
        assertThat(subnet.text("vpcId")).contains(vpcId);
        assertThat(subnet.text("subnetArn")).hasValueSatisfying(arn ->
                assertThat(arn).startsWith("arn:aws:ec2:us-east-1:" + Ec2Fixture.ACCOUNT + ":subnet/subnet-"));
    }

    @Test
    void cidrMustLieInsideTheVpc() {
        String vpcId = ec2.createVpc("10.0.0.0/16");

        assertThatThrownBy(() -> ec2.createSubnet(vpcId, "10.1.0.0/24"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidSubnet.Range"));
    }

    @Test
    void overlappingSubnetsConflict() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        ec2.createSubnet(vpcId, "10.0.0.0/20");

        assertThatThrownBy(() -> ec2.createSubnet(vpcId, "10.0.1.0/24"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidSubnet.Conflict"));

        // same range in another VPC is fine
        String other = ec2.createVpc("10.0.0.0/16");
        assertThat(ec2.createSubnet(other, "10.0.1.0/24")).startsWith("subnet-");
    }

    @Test
    void unknownZoneAndVpcAreRejected() {
        String vpcId = ec2.createVpc("10.0.0.0/16");

        assertThatThrownBy(() -> ec2.call("CreateSubnet", "VpcId", vpcId, "CidrBlock", "10.0.1.0/24",
                "AvailabilityZone", "eu-west-1a"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
        assertThatThrownBy(() -> ec2.createSubnet("vpc-00000000000000000", "10.0.1.0/24"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidVpcID.NotFound"));
    }

    @Test
    void describeFiltersByZoneAndDeleteRemoves() {
        String vpcId = ec2.createVpc("10.0.0.0/16");
        String a = ec2.createSubnet(vpcId, "10.0.1.0/24");
        String b = Ec2Fixture.text(ec2.call("CreateSubnet", "VpcId", vpcId, "CidrBlock", "10.0.2.0/24",
                "AvailabilityZone", "us-east-1b"), "subnet", "subnetId");

        assertThat(items(ec2.call("DescribeSubnets", "Filter.1.Name", "availability-zone", "Filter.1.Value.1", "us-east-1b"),
                "subnetSet")).extracting(s -> s.text("subnetId").orElseThrow()).containsExactly(b);

        ec2.call("DeleteSubnet", "SubnetId", a);
        assertThat(items(ec2.call("DescribeSubnets"), "subnetSet")).hasSize(1);
    }
}
