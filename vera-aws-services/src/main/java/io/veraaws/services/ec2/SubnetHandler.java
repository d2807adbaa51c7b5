package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;

import java.util.Map;
import java.util.Optional;

import static io.veraaws.services.ec2.Ec2ResourceTypes.INSTANCE;
import static io.veraaws.services.ec2.Ec2ResourceTypes.SUBNET;
import static io.veraaws.services.ec2.Ec2ResourceTypes.VPC;

final class SubnetHandler extends Ec2ActionHandler {

    // network, router, DNS, reserved, broadcast
    static final int RESERVED_ADDRESSES = 5;

    private final Object lock = new Object();

    SubnetHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateSubnet", "DescribeSubnets", "DeleteSubnet");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateSubnet" -> create(params, context);
            case "DescribeSubnets" -> page(select(SUBNET, params, "SubnetId"), params, "subnetSet", s -> render(s, context));
            case "DeleteSubnet" -> delete(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params, RequestContext context) {
        String vpcId = Params.require(params, "VpcId");
        Cidr cidr = Cidr.parse("cidrBlock", Params.require(params, "CidrBlock"));
        RegionCatalog.Zone zone = zone(params, context.region());
        Map<String, String> tags = Params.tagSpecifications(params, SUBNET.name());

        Resource subnet;
        synchronized (lock) {
            Resource vpc = store.get(VPC, vpcId);
            Cidr vpcCidr = Cidr.parse("cidrBlock", vpc.attribute("cidrBlock").orElseThrow());
            if (cidr.prefix() < 16 || cidr.prefix() > 28 || !vpcCidr.contains(cidr)) {
                throw new AwsException.ValidationFailed("InvalidSubnet.Range", "The CIDR '" + cidr + "' is invalid.");
            }
            for (String referrer : store.referencesTo(vpcId)) {
                Optional<Resource> sibling = store.find(SUBNET, referrer);
                if (sibling.isPresent() && cidr.overlaps(cidrOf(sibling.get()))) {
                    throw new AwsException.ValidationFailed("InvalidSubnet.Conflict",
                            "The CIDR '" + cidr + "' conflicts with another subnet");
                }
            }
            Params.checkDryRun(params);
            subnet = createSubnet(store, vpcId, cidr, zone, false, context.accountId(), tags);
        }
        return ActionResult.of(ValueTree.Mapping.builder().put("subnet", render(subnet, context)).build());
    }

    private static RegionCatalog.Zone zone(ValueTree.Mapping params, String region) {
        Optional<String> name = Params.text(params, "AvailabilityZone");
        Optional<String> id = Params.text(params, "AvailabilityZoneId");
        for (RegionCatalog.Zone z : RegionCatalog.zones(region)) {
            if (name.isPresent() ? z.name().equals(name.get()) : id.isEmpty() || z.id().equals(id.get())) return z;
        }
        if (name.isPresent()) throw AwsException.MalformedParameter.invalidValue("AvailabilityZone", name.get());
        throw AwsException.MalformedParameter.invalidValue("AvailabilityZoneId", id.orElse(""));
    }

    private ActionResult delete(ValueTree.Mapping params) {
        String id = Params.require(params, "SubnetId");
        store.get(SUBNET, id);
        Params.checkDryRun(params);
        store.delete(SUBNET, id);
        return ActionResult.ok();
    }

    static Resource createSubnet(ResourceStore store, String vpcId, Cidr cidr, RegionCatalog.Zone zone,
                                 boolean defaultForAz, String accountId, Map<String, String> tags) {
        ValueTree.Mapping attributes = ValueTree.Mapping.builder()
                .put("vpcId", vpcId)
                .put("cidrBlock", cidr.toString())
                .put("availabilityZone", zone.name())
                .put("availabilityZoneId", zone.id())
                .put("defaultForAz", defaultForAz)
                .put("mapPublicIpOnLaunch", defaultForAz)
                .put("assignIpv6AddressOnCreation", false)
                .put("ownerId", accountId)
                .build();
        return store.create(SUBNET, attributes, tags);
    }

    static Cidr cidrOf(Resource subnet) {
        return Cidr.parse("cidrBlock", subnet.attribute("cidrBlock").orElseThrow());
    }

    private ValueTree render(Resource subnet, RequestContext context) {
        long used = store.referencesTo(subnet.id()).stream()
                .filter(id -> store.find(INSTANCE, id).isPresent())
                .count();
        long available = cidrOf(subnet).size() - RESERVED_ADDRESSES - used;
        String owner = subnet.attribute("ownerId").orElse(context.accountId());
        return render(subnet, "subnetId")
                .put("state", subnet.state())
                .put("availableIpAddressCount", Math.max(0, available))
                .put("subnetArn", "arn:aws:ec2:" + context.region() + ":" + owner + ":subnet/" + subnet.id())
                .build();
    }
}
