package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import static io.veraaws.services.ec2.Ec2Fixture.items;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VolumeHandlerTest {

    private final Ec2Fixture ec2 = new Ec2Fixture().withDefaultVpc();

    private String createVolume(String zone, String size) {
        return ec2.call("CreateVolume", "AvailabilityZone", zone, "Size", size).text("volumeId").orElseThrow();
    }

    private ValueTree.Mapping describe(String volumeId) {
        return items(ec2.call("DescribeVolumes", "VolumeId.1", volumeId), "volumeSet").get(0);
    }

    @Test
    void createReportsCreatingThenDescribesAvailable() {
        ValueTree.Mapping created = ec2.call("CreateVolume", "AvailabilityZone", "us-east-1a", "Size", "100");

        assertThat(created.text("status")).contains("creating");
        assertThat(created.text("volumeType")).contains("gp2");
        assertThat(created.text("iops")).contains("300");
        assertThat(created.text("volumeId")).hasValueSatisfying(id -> assertThat(id).startsWith("vol-"));
        assertThat(describe(created.text("volumeId").orElseThrow()).text("status")).contains("available");
    }

    @Test
    void gp2BaselineIopsHasAFloor() {
        assertThat(ec2.call("CreateVolume", "AvailabilityZone", "us-east-1a", "Size", "10").text("iops")).contains("100");
    }

    @Test
    void sizeOrSnapshotAndAValidZoneAreRequired() {
        assertThatThrownBy(() -> ec2.call("CreateVolume", "AvailabilityZone", "us-east-1a"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("MissingParameter"));
        assertThatThrownBy(() -> createVolume("us-east-1z", "8"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
        assertThatThrownBy(() -> ec2.call("CreateVolume", "AvailabilityZone", "us-east-1a", "Size", "8", "VolumeType", "ssd"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
    }

    @Test
    void attachDetachCycle() {
        String instanceId = ec2.runInstance();
        String volumeId = createVolume("us-east-1a", "8");

        ValueTree.Mapping attach = ec2.call("AttachVolume", "VolumeId", volumeId, "InstanceId", instanceId, "Device", "/dev/sdf");
        assertThat(attach.text("status")).contains("attaching");
        ValueTree.Mapping attached = describe(volumeId);
        assertThat(attached.text("status")).contains("in-use");
        assertThat(items(attached, "attachmentSet")).singleElement()
                .satisfies(a -> assertThat(a.text("instanceId")).contains(instanceId));

        assertThatThrownBy(() -> ec2.call("AttachVolume", "VolumeId", volumeId, "InstanceId", instanceId, "Device", "/dev/sdg"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("VolumeInUse"));
        assertThatThrownBy(() -> ec2.call("DeleteVolume", "VolumeId", volumeId))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("VolumeInUse"));

        ValueTree.Mapping detach = ec2.call("DetachVolume", "VolumeId", volumeId);
        assertThat(detach.text("status")).contains("detaching");
        assertThat(detach.text("device")).contains("/dev/sdf");
        assertThat(describe(volumeId).text("status")).contains("available");

        assertThatThrownBy(() -> ec2.call("DetachVolume", "VolumeId", volumeId))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("IncorrectState"));
        ec2.call("DeleteVolume", "VolumeId", volumeId);
        assertThat(ec2.store.find(Ec2ResourceTypes.VOLUME, volumeId)).isEmpty();
    }

    @Test
    void attachRequiresTheInstanceZoneAndAFreeDevice() {
        String instanceId = ec2.runInstance();
        String elsewhere = createVolume("us-east-1b", "8");

        assertThatThrownBy(() -> ec2.call("AttachVolume", "VolumeId", elsewhere, "InstanceId", instanceId, "Device", "/dev/sdf"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidVolume.ZoneMismatch"));

        String first = createVolume("us-east-1a", "8");
        String second = createVolume("us-east-1a", "8");
        ec2.call("AttachVolume", "VolumeId", first, "InstanceId", instanceId, "Device", "/dev/sdf");
        assertThatThrownBy(() -> ec2.call("AttachVolume", "VolumeId", second, "InstanceId", instanceId, "Device", "/dev/sdf"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
    }

    @Test
    void terminatingTheInstanceDetachesItsVolumes() {
        String instanceId = ec2.runInstance();
        String volumeId = createVolume("us-east-1a", "8");
        ec2.call("AttachVolume", "VolumeId", volumeId, "InstanceId", instanceId, "Device", "/dev/sdf");

        ec2.call("TerminateInstances", "InstanceId.1", instanceId);

        ValueTree.Mapping volume = describe(volumeId);
        assertThat(volume.text("status")).contains("available");
        assertThat(items(volume, "attachmentSet")).isEmpty();
    }

    @Test
    void unknownVolumeUsesItsOwnNotFoundCode() {
        assertThatThrownBy(() -> ec2.call("DescribeVolumes", "VolumeId.1", "vol-00000000000000000"))
                .isInstanceOfSatisfying(AwsException.class, e -> assertThat(e.errorCode()).isEqualTo("InvalidVolume.NotFound"));
    }
}
