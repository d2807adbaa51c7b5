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
import java.util.Set;

import static io.veraaws.services.ec2.Ec2ResourceTypes.INSTANCE;
import static io.veraaws.services.ec2.Ec2ResourceTypes.VOLUME;

final class VolumeHandler extends Ec2ActionHandler {

    static final String DEFAULT_VOLUME_TYPE = "gp2";

    private static final Set<String> VOLUME_TYPES = Set.of("standard", "gp2", "gp3", "io1", "io2", "st1", "sc1");
    private static final int MAX_SIZE_GIB = 16384;

    VolumeHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateVolume", "DescribeVolumes", "DeleteVolume", "AttachVolume", "DetachVolume");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateVolume" -> create(params, context);
            case "DescribeVolumes" -> page(select(VOLUME, params, "VolumeId"), params, "volumeSet", VolumeHandler::render);
            case "DeleteVolume" -> delete(params);
            case "AttachVolume" -> attach(params, context);
            case "DetachVolume" -> detach(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params, RequestContext context) {
        String zone = Params.require(params, "AvailabilityZone");
        if (!RegionCatalog.isZone(context.region(), zone)) {
            throw AwsException.MalformedParameter.invalidValue("AvailabilityZone", zone);
        }
        Optional<Integer> size = Params.integer(params, "Size");
        Optional<String> snapshotId = Params.text(params, "SnapshotId");
        if (size.isEmpty() && snapshotId.isEmpty()) throw AwsException.MalformedParameter.missing("Size");
        int gib = size.orElse(8);
        if (gib < 1 || gib > MAX_SIZE_GIB) throw AwsException.MalformedParameter.invalidValue("Size", Integer.toString(gib));
        String volumeType = Params.text(params, "VolumeType").orElse(DEFAULT_VOLUME_TYPE);
        if (!VOLUME_TYPES.contains(volumeType)) throw AwsException.MalformedParameter.invalidValue("VolumeType", volumeType);
        Optional<Integer> requestedIops = Params.integer(params, "Iops");
        if (requestedIops.isEmpty() && (volumeType.equals("io1") || volumeType.equals("io2"))) {
            throw AwsException.MalformedParameter.missing("Iops");
        }
        Map<String, String> tags = Params.tagSpecifications(params, VOLUME.name());
        Params.checkDryRun(params);

        ValueTree.Scalar iops = requestedIops.isPresent()
                ? ValueTree.of(requestedIops.get().longValue())
                : baselineIops(volumeType, gib);
        ValueTree.Mapping attributes = ValueTree.Mapping.builder()
                .put("size", gib)
                .put("snapshotId", snapshotId.orElse(""))
                .put("availabilityZone", zone)
                .put("createTime", timestamp(context.receivedAt()))
                .put("volumeType", volumeType)
                .put("iops", iops)
                .put("encrypted", Params.flag(params, "Encrypted"))
                .put("multiAttachEnabled", false)
                .put("attachmentSet", new ValueTree.Sequence(List.of()))
                .build();
        Resource created = store.create(VOLUME, attributes, tags);
        store.update(VOLUME, created.id(), e -> e.state("available"));
        return ActionResult.of(render(created));
    }

    /** Baseline IOPS of the types that have one. */
    private static ValueTree.Scalar baselineIops(String volumeType, int gib) {
        return switch (volumeType) {
            case "gp2" -> ValueTree.of(Math.min(16000L, Math.max(100L, 3L * gib)));
            case "gp3" -> ValueTree.of(3000L);
            default -> null;
        };
    }

    private ActionResult delete(ValueTree.Mapping params) {
        String id = Params.require(params, "VolumeId");
        Resource volume = store.get(VOLUME, id);
        if ("in-use".equals(volume.state())) {
            String instanceId = attachment(volume.attributes()).flatMap(a -> a.text("instanceId")).orElse("");
            throw new AwsException.ValidationFailed("VolumeInUse", "Volume " + id + " is currently attached to " + instanceId);
        }
        Params.checkDryRun(params);
        store.delete(VOLUME, id);
        return ActionResult.ok();
    }

    private ActionResult attach(ValueTree.Mapping params, RequestContext context) {
        String volumeId = Params.require(params, "VolumeId");
        String instanceId = Params.require(params, "InstanceId");
        String device = Params.require(params, "Device");
        Resource instance = store.get(INSTANCE, instanceId);
        store.get(VOLUME, volumeId);
        if (!"running".equals(instance.state()) && !"stopped".equals(instance.state())) {
            throw new AwsException.ValidationFailed("IncorrectState",
                    "Instance '" + instanceId + "' is not 'running'.");
        }
        for (String referrer : store.referencesTo(instanceId)) {
            Optional<String> used = store.find(VOLUME, referrer)
                    .flatMap(v -> attachment(v.attributes()))
                    .flatMap(a -> a.text("device"));
            if (used.isPresent() && used.get().equals(device)) {
                throw new AwsException.MalformedParameter("Invalid value '" + device
                        + "' for unixDevice. Attachment point " + device + " is already in use");
            }
        }
        String instanceZone = instance.attributes().mapping("placement")
                .flatMap(p -> p.text("availabilityZone")).orElse(null);
        Params.checkDryRun(params);

        String attachTime = timestamp(context.receivedAt());
        store.update(VOLUME, volumeId, e -> {
            if (!"available".equals(e.state())) {
                throw new AwsException.ValidationFailed("VolumeInUse", volumeId + " is already attached to an instance");
            }
            if (instanceZone != null && !instanceZone.equals(e.attributes().text("availabilityZone").orElse(null))) {
                throw new AwsException.ValidationFailed("InvalidVolume.ZoneMismatch", "The volume '" + volumeId
                        + "' is not in the same availability zone as instance '" + instanceId + "'");
            }
            e.set("attachmentSet", ValueTree.Sequence.of(attachmentTree(volumeId, instanceId, device, "attached", attachTime)));
            e.state("in-use");
        });
        return ActionResult.of(attachmentTree(volumeId, instanceId, device, "attaching", attachTime));
    }

    private ActionResult detach(ValueTree.Mapping params) {
        String volumeId = Params.require(params, "VolumeId");
        Optional<String> instanceId = Params.text(params, "InstanceId");
        store.get(VOLUME, volumeId);
        instanceId.ifPresent(id -> store.get(INSTANCE, id));
        Params.checkDryRun(params);

        ValueTree.Mapping[] previous = new ValueTree.Mapping[1];
        store.update(VOLUME, volumeId, e -> {
            Optional<ValueTree.Mapping> current = attachment(e.attributes());
            if (!"in-use".equals(e.state()) || current.isEmpty()) {
                throw new AwsException.ValidationFailed("IncorrectState",
                        "Volume '" + volumeId + "' is in the '" + e.state() + "' state.");
            }
            if (instanceId.isPresent() && !instanceId.get().equals(current.get().text("instanceId").orElse(null))) {
                throw new AwsException.ValidationFailed("InvalidAttachment.NotFound",
                        "Volume '" + volumeId + "' can not be detached from '" + instanceId.get() + "'");
            }
            previous[0] = current.get();
            e.set("attachmentSet", new ValueTree.Sequence(List.of()));
            e.state("available");
        });
        return ActionResult.of(previous[0].with("status", ValueTree.of("detaching")));
    }

    /** Drops the volume's attachment if it has one. */
    static void detach(ResourceStore store, String volumeId) {
        store.update(VOLUME, volumeId, e -> {
            if (attachment(e.attributes()).isEmpty()) return;
            e.set("attachmentSet", new ValueTree.Sequence(List.of()));
            e.state("available");
        });
    }

    private static Optional<ValueTree.Mapping> attachment(ValueTree.Mapping attributes) {
        for (ValueTree item : attributes.sequence("attachmentSet")) {
            if (item instanceof ValueTree.Mapping m) return Optional.of(m);
        }
        return Optional.empty();
    }

    private static ValueTree.Mapping attachmentTree(String volumeId, String instanceId, String device, String status,
                                                    String attachTime) {
        return ValueTree.Mapping.builder()
                .put("volumeId", volumeId)
                .put("instanceId", instanceId)
                .put("device", device)
                .put("status", status)
                .put("attachTime", attachTime)
                .put("deleteOnTermination", false)
                .build();
    }

    static ValueTree.Mapping render(Resource volume) {
        return render(volume, "volumeId").put("status", volume.state()).build();
    }
}
