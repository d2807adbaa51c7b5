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
import java.util.Set;

import static io.veraaws.services.ec2.Ec2ResourceTypes.VPC;

final class VpcHandler extends Ec2ActionHandler {

    private static final Set<String> TENANCIES = Set.of("default", "dedicated", "host");

    VpcHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateVpc", "CreateDefaultVpc", "DescribeVpcs", "DeleteVpc");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateVpc" -> create(params, context);
            case "CreateDefaultVpc" -> createDefault(params, context);
            case "DescribeVpcs" -> page(select(VPC, params, "VpcId"), params, "vpcSet", VpcHandler::render);
            case "DeleteVpc" -> delete(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params, RequestContext context) {
        Cidr cidr = Cidr.parse("cidrBlock", Params.require(params, "CidrBlock"));
        if (cidr.prefix() < 16 || cidr.prefix() > 28) {
            throw new AwsException.ValidationFailed("InvalidVpc.Range", "The CIDR '" + cidr + "' is invalid.");
        }
        String tenancy = Params.text(params, "InstanceTenancy").orElse("default");
        if (!TENANCIES.contains(tenancy)) {
            throw AwsException.MalformedParameter.invalidValue("InstanceTenancy", tenancy);
        }
        Map<String, String> tags = Params.tagSpecifications(params, VPC.name());
        Params.checkDryRun(params);

        Resource vpc = createVpc(store, cidr, tenancy, false, context.accountId(), tags);
        return ActionResult.of(ValueTree.Mapping.builder().put("vpc", render(vpc)).build());
    }

    private ActionResult createDefault(ValueTree.Mapping params, RequestContext context) {
        Params.checkDryRun(params);
        Resource vpc = DefaultVpc.createIfAbsent(store, context.region(), context.accountId())
                .orElseThrow(() -> new AwsException.ValidationFailed("DefaultVpcAlreadyExists",
                        "A Default VPC already exists for this account in this region."));
        return ActionResult.of(ValueTree.Mapping.builder().put("vpc", render(vpc)).build());
    }

    private ActionResult delete(ValueTree.Mapping params) {
        String id = Params.require(params, "VpcId");
        store.get(VPC, id);
        Params.checkDryRun(params);
        // the store removes the default group with the VPC; anything else still inside blocks it
        store.delete(VPC, id);
        return ActionResult.ok();
    }

    static Resource createVpc(ResourceStore store, Cidr cidr, String tenancy, boolean isDefault, String accountId,
                              Map<String, String> tags) {
        ValueTree.Mapping association = ValueTree.Mapping.builder()
                .put("cidrBlock", cidr.toString())
                .put("cidrBlockState", ValueTree.Mapping.builder().put("state", "associated").build())
                .build();
        ValueTree.Mapping attributes = ValueTree.Mapping.builder()
                .put("cidrBlock", cidr.toString())
                .put("cidrBlockAssociationSet", ValueTree.Sequence.of(association))
                .put("dhcpOptionsId", "default")
                .put("instanceTenancy", tenancy)
                .put("isDefault", isDefault)
                .put("ownerId", accountId)
                .build();
        Resource vpc = store.create(VPC, attributes, tags);
        SecurityGroupHandler.createDefaultGroup(store, vpc.id(), accountId);
        return vpc;
    }

    static ValueTree render(Resource vpc) {
        return render(vpc, "vpcId").put("state", vpc.state()).build();
    }
}
