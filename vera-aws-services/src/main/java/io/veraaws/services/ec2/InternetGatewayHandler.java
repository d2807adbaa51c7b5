package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.veraaws.services.ec2.Ec2ResourceTypes.INTERNET_GATEWAY;
import static io.veraaws.services.ec2.Ec2ResourceTypes.VPC;

final class InternetGatewayHandler extends Ec2ActionHandler {

    private final Object lock = new Object();

    InternetGatewayHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateInternetGateway", "DescribeInternetGateways", "DeleteInternetGateway",
                "AttachInternetGateway", "DetachInternetGateway");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateInternetGateway" -> create(params, context);
            case "DescribeInternetGateways" -> page(select(INTERNET_GATEWAY, params, "InternetGatewayId"), params,
                    "internetGatewaySet", InternetGatewayHandler::render);
            case "DeleteInternetGateway" -> delete(params);
            case "AttachInternetGateway" -> attach(params);
            case "DetachInternetGateway" -> detach(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params, RequestContext context) {
        Map<String, String> tags = Params.tagSpecifications(params, INTERNET_GATEWAY.name());
        Params.checkDryRun(params);
        Resource igw = createGateway(store, context.accountId(), tags);
        return ActionResult.of(ValueTree.Mapping.builder().put("internetGateway", render(igw)).build());
    }

    static Resource createGateway(ResourceStore store, String accountId, Map<String, String> tags) {
        ValueTree.Mapping attributes = ValueTree.Mapping.builder()
                .put("ownerId", accountId)
                .put("attachmentSet", new ValueTree.Sequence(List.of()))
                .build();
        return store.create(INTERNET_GATEWAY, attributes, tags);
    }

    private ActionResult delete(ValueTree.Mapping params) {
        String id = Params.require(params, "InternetGatewayId");
        Resource igw = store.get(INTERNET_GATEWAY, id);
        if (attachedVpc(igw.attributes()).isPresent()) {
            throw new AwsException.DependencyViolation(INTERNET_GATEWAY.name(), id);
        }
        Params.checkDryRun(params);
        store.delete(INTERNET_GATEWAY, id);
        return ActionResult.ok();
    }

    private ActionResult attach(ValueTree.Mapping params) {
        String id = Params.require(params, "InternetGatewayId");
        String vpcId = Params.require(params, "VpcId");
        store.get(INTERNET_GATEWAY, id);
        store.get(VPC, vpcId);
        Params.checkDryRun(params);
        synchronized (lock) {
            for (String referrer : store.referencesTo(vpcId)) {
                if (!referrer.equals(id) && store.find(INTERNET_GATEWAY, referrer).isPresent()) {
                    throw new AwsException.ValidationFailed("Resource.AlreadyAssociated",
                            "resource " + vpcId + " is already attached to network gateway " + referrer);
                }
            }
            store.update(INTERNET_GATEWAY, id, e -> {
                Optional<String> current = attachedVpc(e.attributes());
                if (current.isPresent()) {
                    throw new AwsException.ValidationFailed("Resource.AlreadyAssociated",
                            "resource " + id + " is already attached to network " + current.get());
                }
                e.set("attachmentSet", ValueTree.Sequence.of(ValueTree.Mapping.builder()
                        .put("vpcId", vpcId)
                        .put("state", "available")
                        .build()));
            });
        }
        return ActionResult.ok();
    }

    private ActionResult detach(ValueTree.Mapping params) {
        String id = Params.require(params, "InternetGatewayId");
        String vpcId = Params.require(params, "VpcId");
        store.get(INTERNET_GATEWAY, id);
        Params.checkDryRun(params);
        store.update(INTERNET_GATEWAY, id, e -> {
            if (!attachedVpc(e.attributes()).map(vpcId::equals).orElse(false)) {
                throw new AwsException.ValidationFailed("Gateway.NotAttached",
                        "resource " + id + " is not attached to network " + vpcId);
            }
            e.set("attachmentSet", new ValueTree.Sequence(List.of()));
        });
        return ActionResult.ok();
    }

    private static Optional<String> attachedVpc(ValueTree.Mapping attributes) {
        for (ValueTree item : attributes.sequence("attachmentSet")) {
            if (item instanceof ValueTree.Mapping m && m.text("vpcId").isPresent()) return m.text("vpcId");
        }
        return Optional.empty();
    }

    static ValueTree render(Resource igw) {
        return render(igw, "internetGatewayId").build();
    }
}
