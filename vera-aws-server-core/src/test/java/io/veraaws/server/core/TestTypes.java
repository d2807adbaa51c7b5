package io.veraaws.server.core;

import io.veraaws.server.spi.IdFormat;
import io.veraaws.server.spi.ResourceType;
import io.veraaws.server.spi.ResourceTypeRegistry;

/**
 * Small type graph used by the store and filter tests.
 */
final class TestTypes {
    static final ResourceType VPC = ResourceType.builder("vpc")
            .states("available", "pending")
            .filter("vpc-id", FilterEvaluator.ID_PATH)
            .filter("state", FilterEvaluator.STATE_PATH)
            .filter("cidr-block", "cidrBlock")
            .cascade("security-group", group -> group.attribute("groupName").filter("default"::equals).isPresent())
            .notFoundCode("InvalidVpcID.NotFound")
            .build();

    static final ResourceType SUBNET = ResourceType.builder("subnet")
            .states("available")
            .reference("vpcId", "vpc")
            .filter("vpc-id", "vpcId")
            .notFoundCode("InvalidSubnetID.NotFound")
            .build();

    static final ResourceType SECURITY_GROUP = ResourceType.builder("security-group")
            .idPrefix("sg")
            .reference("vpcId", "vpc")
            .filter("group-name", "groupName")
            .notFoundCode("InvalidGroup.NotFound")
            .build();

    static final ResourceType INSTANCE = ResourceType.builder("instance")
            .idPrefix("i")
            .states("pending", "running", "stopped", "terminated")
            .reference("subnetId", "subnet")
            .reference("groupSet.groupId", "security-group")
            .filter("instance-type", "instanceType")
            .filter("instance-state-name", FilterEvaluator.STATE_PATH)
            .filter("instance.group-id", "groupSet.groupId")
            .build();

    static final ResourceType KEY_PAIR = ResourceType.builder("key-pair")
            .idPrefix("key")
            .idFormat(IdFormat.SHORT)
            .filter("key-name", "keyName")
            .build();

    static ResourceTypeRegistry registry() {
        return ResourceTypeRegistry.builder()
                .register(VPC)
                .register(SUBNET)
                .register(SECURITY_GROUP)
                .register(INSTANCE)
                .register(KEY_PAIR)
                .build();
    }

    private TestTypes() {}
}
