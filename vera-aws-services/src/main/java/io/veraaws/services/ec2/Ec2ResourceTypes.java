package io.veraaws.services.ec2;

import io.veraaws.server.spi.ResourceType;
import io.veraaws.server.spi.ResourceTypeRegistry;

import java.util.List;

/**
 * EC2 resource types: id prefixes, lifecycle states, reference fields, describe filters and the
 * cascade table.
 */
public final class Ec2ResourceTypes {

    private static final String ID = ResourceType.ID_PATH;
    private static final String STATE = ResourceType.STATE_PATH;

    public static final ResourceType VPC = ResourceType.builder("vpc")
            .states("available", "pending")
            .filter("vpc-id", ID)
            .filter("state", STATE)
            .filter("cidr", "cidrBlock")
            .filter("cidr-block", "cidrBlock")
            .filter("cidr-block-association.cidr-block", "cidrBlockAssociationSet.cidrBlock")
            .filter("dhcp-options-id", "dhcpOptionsId")
            .filter("instance-tenancy", "instanceTenancy")
            .filter("is-default", "isDefault")
            .filter("owner-id", "ownerId")
            .cascade("security-group", SecurityGroupHandler::isDefaultGroup)
            .build();

    public static final ResourceType SUBNET = ResourceType.builder("subnet")
            .states("available", "pending")
            .reference("vpcId", "vpc")
            .filter("subnet-id", ID)
            .filter("state", STATE)
            .filter("vpc-id", "vpcId")
            .filter("cidr", "cidrBlock")
            .filter("cidr-block", "cidrBlock")
            .filter("cidrBlock", "cidrBlock")
            .filter("availability-zone", "availabilityZone")
            .filter("availabilityZone", "availabilityZone")
            .filter("availability-zone-id", "availabilityZoneId")
            .filter("default-for-az", "defaultForAz")
            .filter("defaultForAz", "defaultForAz")
            .filter("map-public-ip-on-launch", "mapPublicIpOnLaunch")
            .filter("owner-id", "ownerId")
            .build();

    public static final ResourceType SECURITY_GROUP = ResourceType.builder("security-group")
            .idPrefix("sg")
            .reference("vpcId", "vpc")
            .reference("ipPermissions.groups.groupId", "security-group")
            .filter("group-id", ID)
            .filter("group-name", "groupName")
            .filter("description", "groupDescription")
            .filter("vpc-id", "vpcId")
            .filter("owner-id", "ownerId")
            .filter("ip-permission.protocol", "ipPermissions.ipProtocol")
            .filter("ip-permission.from-port", "ipPermissions.fromPort")
            .filter("ip-permission.to-port", "ipPermissions.toPort")
            .filter("ip-permission.cidr", "ipPermissions.ipRanges.cidrIp")
            .filter("ip-permission.group-id", "ipPermissions.groups.groupId")
            .filter("egress.ip-permission.protocol", "ipPermissionsEgress.ipProtocol")
            .filter("egress.ip-permission.cidr", "ipPermissionsEgress.ipRanges.cidrIp")
            .notFoundCode("InvalidGroup.NotFound")
            .build();

    public static final ResourceType INSTANCE = ResourceType.builder("instance")
            .idPrefix("i")
            .states("pending", "running", "stopping", "stopped", "shutting-down", "terminated")
            .reference("subnetId", "subnet")
            .reference("vpcId", "vpc")
            .reference("groupSet.groupId", "security-group")
            .filter("instance-id", ID)
            .filter("instance-state-name", STATE)
            .filter("instance-type", "instanceType")
            .filter("image-id", "imageId")
            .filter("key-name", "keyName")
            .filter("subnet-id", "subnetId")
            .filter("vpc-id", "vpcId")
            .filter("availability-zone", "placement.availabilityZone")
            .filter("private-ip-address", "privateIpAddress")
            .filter("private-dns-name", "privateDnsName")
            .filter("reservation-id", "reservationId")
            .filter("architecture", "architecture")
            .filter("instance.group-id", "groupSet.groupId")
            .filter("instance.group-name", "groupSet.groupName")
            .filter("group-id", "groupSet.groupId")
            .filter("group-name", "groupSet.groupName")
            .build();

    public static final ResourceType VOLUME = ResourceType.builder("volume")
            .idPrefix("vol")
            .states("creating", "available", "in-use", "deleting", "deleted", "error")
            .reference("attachmentSet.instanceId", "instance")
            .filter("volume-id", ID)
            .filter("status", STATE)
            .filter("availability-zone", "availabilityZone")
            .filter("size", "size")
            .filter("volume-type", "volumeType")
            .filter("snapshot-id", "snapshotId")
            .filter("encrypted", "encrypted")
            .filter("create-time", "createTime")
            .filter("attachment.instance-id", "attachmentSet.instanceId")
            .filter("attachment.device", "attachmentSet.device")
            .filter("attachment.status", "attachmentSet.status")
            .filter("attachment.delete-on-termination", "attachmentSet.deleteOnTermination")
            .notFoundCode("InvalidVolume.NotFound")
            .build();

    public static final ResourceType INTERNET_GATEWAY = ResourceType.builder("internet-gateway")
            .idPrefix("igw")
            .reference("attachmentSet.vpcId", "vpc")
            .filter("internet-gateway-id", ID)
            .filter("attachment.vpc-id", "attachmentSet.vpcId")
            .filter("attachment.state", "attachmentSet.state")
            .filter("owner-id", "ownerId")
            .build();

    public static final ResourceType KEY_PAIR = ResourceType.builder("key-pair")
            .idPrefix("key")
            .filter("key-pair-id", ID)
            .filter("key-name", "keyName")
            .filter("fingerprint", "keyFingerprint")
            .filter("key-type", "keyType")
            .notFoundCode("InvalidKeyPair.NotFound")
            .build();

    public static final List<ResourceType> ALL = List.of(VPC, SUBNET, SECURITY_GROUP, INSTANCE, VOLUME, INTERNET_GATEWAY, KEY_PAIR);

    public static ResourceTypeRegistry registry() {
        return ResourceTypeRegistry.builder().registerAll(ALL).build();
    }

    private Ec2ResourceTypes() {}
}
