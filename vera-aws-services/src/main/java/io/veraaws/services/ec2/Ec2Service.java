package io.veraaws.services.ec2;

import io.veraaws.core.Protocol;
import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.server.spi.ServiceProtocol;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The EC2 service: its wire definition and the handlers serving its actions.
 */
public final class Ec2Service {

    public static final String NAME = "ec2";

    public static final Set<String> ACTIONS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "CreateVpc", "CreateDefaultVpc", "DescribeVpcs", "DeleteVpc",
            "CreateSubnet", "DescribeSubnets", "DeleteSubnet",
            "CreateSecurityGroup", "DescribeSecurityGroups", "DeleteSecurityGroup",
            "AuthorizeSecurityGroupIngress", "RevokeSecurityGroupIngress",
            "CreateInternetGateway", "DescribeInternetGateways", "DeleteInternetGateway",
            "AttachInternetGateway", "DetachInternetGateway",
            "RunInstances", "DescribeInstances", "StartInstances", "StopInstances", "TerminateInstances",
            "CreateVolume", "DescribeVolumes", "DeleteVolume", "AttachVolume", "DetachVolume",
            "CreateKeyPair", "ImportKeyPair", "DescribeKeyPairs", "DeleteKeyPair",
            "CreateTags", "DeleteTags", "DescribeTags",
            "DescribeRegions", "DescribeAvailabilityZones", "DescribeAccountAttributes")));

    public static final ServiceDefinition DEFINITION =
            new ServiceDefinition(NAME, ServiceProtocol.EC2, Protocol.EC2_NAMESPACE, null, ACTIONS);

    private Ec2Service() {}

    public static List<ActionHandler> handlers(ResourceStore store, ResourceFilter filter) {
        return List.of(
                new VpcHandler(store, filter),
                new SubnetHandler(store, filter),
                new SecurityGroupHandler(store, filter),
                new InternetGatewayHandler(store, filter),
                new InstanceHandler(store, filter),
                new VolumeHandler(store, filter),
                new KeyPairHandler(store, filter),
                new TagHandler(store, filter),
                new CatalogHandler(store, filter));
    }
}
