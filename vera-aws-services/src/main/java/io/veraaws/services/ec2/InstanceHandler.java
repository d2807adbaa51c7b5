package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Pagination;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.veraaws.services.ec2.Ec2ResourceTypes.INSTANCE;
import static io.veraaws.services.ec2.Ec2ResourceTypes.KEY_PAIR;
import static io.veraaws.services.ec2.Ec2ResourceTypes.SECURITY_GROUP;
import static io.veraaws.services.ec2.Ec2ResourceTypes.SUBNET;
import static io.veraaws.services.ec2.Ec2ResourceTypes.VOLUME;

final class InstanceHandler extends Ec2ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(InstanceHandler.class);

    static final int MAX_INSTANCES = 20;
    static final String DEFAULT_INSTANCE_TYPE = "m1.small";

    private static final Map<String, Integer> STATE_CODES = Map.of(
            "pending", 0, "running", 16, "shutting-down", 32, "terminated", 48, "stopping", 64, "stopped", 80);

    // attributes that tie an instance to its network; dropped on termination
    private static final List<String> NETWORK_ATTRIBUTES = List.of(
            "subnetId", "vpcId", "privateIpAddress", "privateDnsName", "groupSet");

    private final Object lock = new Object();

    InstanceHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "RunInstances", "DescribeInstances", "StartInstances", "StopInstances", "TerminateInstances");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "RunInstances" -> run(params, context);
            case "DescribeInstances" -> describe(params, context);
            case "StartInstances" -> transition(params, "running", InstanceHandler::startable);
            case "StopInstances" -> transition(params, "stopped", InstanceHandler::stoppable);
            case "TerminateInstances" -> terminate(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult run(ValueTree.Mapping params, RequestContext context) {
        String imageId = Params.require(params, "ImageId");
        int min = Params.integer(params, "MinCount").orElseThrow(() -> AwsException.MalformedParameter.missing("MinCount"));
        int max = Params.integer(params, "MaxCount").orElseThrow(() -> AwsException.MalformedParameter.missing("MaxCount"));
        if (min < 1) throw AwsException.MalformedParameter.invalidValue("MinCount", Integer.toString(min));
        if (max < min) throw AwsException.MalformedParameter.invalidValue("MaxCount", Integer.toString(max));
        if (min > MAX_INSTANCES) {
            throw new AwsException.ValidationFailed("InstanceLimitExceeded",
                    "You have requested more instances (" + min + ") than your current instance limit of "
                            + MAX_INSTANCES + " allows for the specified instance type.");
        }
        int count = Math.min(max, MAX_INSTANCES);
        String instanceType = Params.text(params, "InstanceType").orElse(DEFAULT_INSTANCE_TYPE);

        Optional<String> keyName = Params.text(params, "KeyName");
        if (keyName.isPresent() && KeyPairHandler.findByName(store, keyName.get()).isEmpty()) {
            throw new AwsException.NotFound(KEY_PAIR.notFoundCode(), "key pair", keyName.get());
        }

        Optional<String> placementZone = Params.mappings(params, "Placement").stream()
                .findFirst()
                .flatMap(p -> Params.text(p, "AvailabilityZone"));
        Resource subnet = subnet(params, placementZone.orElse(null));
        String zone = subnet.attribute("availabilityZone").orElseThrow();
        if (placementZone.isPresent() && !placementZone.get().equals(zone)) {
            throw AwsException.MalformedParameter.invalidValue("Placement.AvailabilityZone", placementZone.get());
        }
        String vpcId = subnet.attribute("vpcId").orElseThrow();
        List<Resource> groups = groups(params, vpcId, subnet.id());
        Map<String, String> tags = Params.tagSpecifications(params, INSTANCE.name());
        Params.checkDryRun(params);

        List<ValueTree> groupSet = new ArrayList<>();
        for (Resource g : groups) {
            groupSet.add(ValueTree.Mapping.builder()
                    .put("groupId", g.id())
                    .put("groupName", g.attribute("groupName").orElse(null))
                    .build());
        }

        List<Resource> launched = new ArrayList<>(count);
        String reservationId = null;
        synchronized (lock) {
            Cidr cidr = SubnetHandler.cidrOf(subnet);
            Set<String> used = usedAddresses(subnet.id());
            for (int i = 0; i < count; i++) {
                String ip = nextAddress(cidr, used);
                used.add(ip);
                ValueTree.Mapping attributes = ValueTree.Mapping.builder()
                        .put("imageId", imageId)
                        .put("instanceType", instanceType)
                        .put("keyName", keyName.orElse(null))
                        .put("amiLaunchIndex", i)
                        .put("launchTime", timestamp(context.receivedAt()))
                        .put("placement", ValueTree.Mapping.builder()
                                .put("availabilityZone", zone)
                                .put("groupName", "")
                                .put("tenancy", "default")
                                .build())
                        .put("monitoring", ValueTree.Mapping.builder().put("state", "disabled").build())
                        .put("subnetId", subnet.id())
                        .put("vpcId", vpcId)
                        .put("privateIpAddress", ip)
                        .put("privateDnsName", privateDnsName(ip, context.region()))
                        .put("groupSet", new ValueTree.Sequence(groupSet))
                        .put("architecture", "x86_64")
                        .put("rootDeviceType", "ebs")
                        .put("rootDeviceName", "/dev/xvda")
                        .put("virtualizationType", "hvm")
                        .put("hypervisor", "xen")
                        .put("ebsOptimized", false)
                        .put("sourceDestCheck", true)
                        .build();
                Resource pending = store.create(INSTANCE, attributes, tags);
                if (reservationId == null) reservationId = "r-" + pending.id().substring("i-".length());
                String reservation = reservationId;
                store.update(INSTANCE, pending.id(), e -> e.set("reservationId", reservation).state("running"));
                launched.add(pending);
            }
        }
        log.debug("Launched {} instance(s) in {} as {}", count, subnet.id(), reservationId);

        List<ValueTree> items = new ArrayList<>(launched.size());
        for (Resource r : launched) items.add(render(r));
        return ActionResult.of(ValueTree.Mapping.builder()
                .put("reservationId", reservationId)
                .put("ownerId", context.accountId())
                .put("groupSet", new ValueTree.Sequence(List.of()))
                .put("instancesSet", new ValueTree.Sequence(items))
                .build());
    }

    private Resource subnet(ValueTree.Mapping params, String zone) {
        Optional<String> id = Params.text(params, "SubnetId");
        if (id.isPresent()) return store.get(SUBNET, id.get());
        return DefaultVpc.subnet(store, zone)
                .orElseThrow(() -> new AwsException.ValidationFailed("VPCIdNotSpecified", "No default VPC for this user"));
    }

    private List<Resource> groups(ValueTree.Mapping params, String vpcId, String subnetId) {
        List<Resource> out = new ArrayList<>();
        for (String id : new LinkedHashSet<>(Params.texts(params, "SecurityGroupId"))) {
            Resource group = store.get(SECURITY_GROUP, id);
            if (!vpcId.equals(group.attribute("vpcId").orElse(null))) {
                throw new AwsException.ValidationFailed("InvalidParameter",
                        "Security group " + id + " and subnet " + subnetId + " belong to different networks.");
            }
            out.add(group);
        }
        for (String name : new LinkedHashSet<>(Params.texts(params, "SecurityGroup"))) {
            out.add(SecurityGroupHandler.findByName(store, vpcId, name)
                    .orElseThrow(() -> new AwsException.NotFound(SECURITY_GROUP.notFoundCode(), "security group", name)));
        }
        if (out.isEmpty()) {
            SecurityGroupHandler.findByName(store, vpcId, SecurityGroupHandler.DEFAULT_GROUP).ifPresent(out::add);
        }
        return out;
    }

    private Set<String> usedAddresses(String subnetId) {
        Set<String> used = new HashSet<>();
        for (String referrer : store.referencesTo(subnetId)) {
            store.find(INSTANCE, referrer).flatMap(i -> i.attribute("privateIpAddress")).ifPresent(used::add);
        }
        return used;
    }

    // first four and the last address of a subnet are reserved
    private static String nextAddress(Cidr cidr, Set<String> used) {
        for (long offset = 4; offset < cidr.size() - 1; offset++) {
            String candidate = cidr.address(offset);
            if (!used.contains(candidate)) return candidate;
        }
        throw new AwsException.ValidationFailed("InsufficientFreeAddressesInSubnet",
                "There are not enough free addresses in subnet to satisfy the requested number of instances.");
    }

    private static String privateDnsName(String ip, String region) {
        String host = "ip-" + ip.replace('.', '-');
        return region.equals("us-east-1") ? host + ".ec2.internal" : host + "." + region + ".compute.internal";
    }

    private ActionResult describe(ValueTree.Mapping params, RequestContext context) {
        Pagination.Page<Resource> page = Pagination.page(select(INSTANCE, params, "InstanceId"), params);
        Map<String, List<ValueTree>> byReservation = new LinkedHashMap<>();
        for (Resource r : page.items()) {
            String reservation = r.attribute("reservationId").orElse("r-" + r.id().substring("i-".length()));
            byReservation.computeIfAbsent(reservation, k -> new ArrayList<>()).add(render(r));
        }
        List<ValueTree> reservations = new ArrayList<>();
        for (Map.Entry<String, List<ValueTree>> e : byReservation.entrySet()) {
            reservations.add(ValueTree.Mapping.builder()
                    .put("reservationId", e.getKey())
                    .put("ownerId", context.accountId())
                    .put("groupSet", new ValueTree.Sequence(List.of()))
                    .put("instancesSet", new ValueTree.Sequence(e.getValue()))
                    .build());
        }
        return ActionResult.of(ValueTree.Mapping.builder()
                .put("reservationSet", new ValueTree.Sequence(reservations))
                .put("nextToken", page.nextToken().orElse(null))
                .build());
    }

    @FunctionalInterface
    private interface Guard {
        void check(String instanceId, String state);
    }

    private static void startable(String id, String state) {
        if (state.equals("terminated") || state.equals("shutting-down")) {
            throw incorrectState(id, "started");
        }
    }

    private static void stoppable(String id, String state) {
        if (state.equals("terminated") || state.equals("shutting-down")) {
            throw incorrectState(id, "stopped");
        }
    }

    private static AwsException incorrectState(String id, String verb) {
        return new AwsException.ValidationFailed("IncorrectInstanceState",
                "The instance '" + id + "' is not in a state from which it can be " + verb + ".");
    }

    private ActionResult transition(ValueTree.Mapping params, String target, Guard guard) {
        List<String> ids = ids(params);
        Params.checkDryRun(params);
        List<ValueTree> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            String[] previous = new String[1];
            Resource updated = store.update(INSTANCE, id, e -> {
                previous[0] = e.state();
                guard.check(id, e.state());
                e.state(target);
            });
            items.add(change(updated, previous[0]));
        }
        return ActionResult.of(ValueTree.Mapping.builder().put("instancesSet", new ValueTree.Sequence(items)).build());
    }

    private ActionResult terminate(ValueTree.Mapping params) {
        List<String> ids = ids(params);
        Params.checkDryRun(params);
        List<ValueTree> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            for (String referrer : store.referencesTo(id)) {
                if (store.find(VOLUME, referrer).isPresent()) VolumeHandler.detach(store, referrer);
            }
            String[] previous = new String[1];
            Resource updated = store.update(INSTANCE, id, e -> {
                previous[0] = e.state();
                for (String attribute : NETWORK_ATTRIBUTES) e.remove(attribute);
                e.state("terminated");
            });
            items.add(change(updated, previous[0]));
        }
        return ActionResult.of(ValueTree.Mapping.builder().put("instancesSet", new ValueTree.Sequence(items)).build());
    }

    /** Requested ids, all checked to exist before any instance changes. */
    private List<String> ids(ValueTree.Mapping params) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(requireIds(params, "InstanceId")));
        for (String id : ids) store.get(INSTANCE, id);
        return ids;
    }

    private static ValueTree change(Resource instance, String previous) {
        return ValueTree.Mapping.builder()
                .put("instanceId", instance.id())
                .put("currentState", state(instance.state()))
                .put("previousState", state(previous))
                .build();
    }

    static ValueTree.Mapping state(String name) {
        return ValueTree.Mapping.builder()
                .put("code", STATE_CODES.getOrDefault(name, 0).longValue())
                .put("name", name)
                .build();
    }

    static ValueTree render(Resource instance) {
        return ValueTree.Mapping.builder()
                .put("instanceId", instance.id())
                .putAll(instance.attributes().without("reservationId"))
                .put("instanceState", state(instance.state()))
                .put("tagSet", tagSet(instance))
                .build();
    }
}
