package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ResourceType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only account catalog: regions, availability zones and account attributes.
 */
final class CatalogHandler extends Ec2ActionHandler {

    static final ResourceType REGION = ResourceType.builder("region")
            .filter("region-name", "regionName")
            .filter("endpoint", "regionEndpoint")
            .filter("opt-in-status", "optInStatus")
            .build();

    static final ResourceType ZONE = ResourceType.builder("availability-zone")
            .filter("zone-name", "zoneName")
            .filter("zone-id", "zoneId")
            .filter("region-name", "regionName")
            .filter("state", "zoneState")
            .filter("zone-type", "zoneType")
            .filter("group-name", "groupName")
            .filter("opt-in-status", "optInStatus")
            .build();

    static final int MAX_INSTANCES = InstanceHandler.MAX_INSTANCES;

    CatalogHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "DescribeRegions", "DescribeAvailabilityZones", "DescribeAccountAttributes");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "DescribeRegions" -> regions(params);
            case "DescribeAvailabilityZones" -> zones(params, context);
            case "DescribeAccountAttributes" -> accountAttributes(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult regions(ValueTree.Mapping params) {
        List<String> names = Params.texts(params, "RegionName");
        List<Resource> rows = new ArrayList<>();
        for (String region : RegionCatalog.REGIONS) {
            if (!names.isEmpty() && !names.contains(region)) continue;
            rows.add(row(REGION, region, ValueTree.Mapping.builder()
                    .put("regionName", region)
                    .put("regionEndpoint", RegionCatalog.endpoint(region))
                    .put("optInStatus", "opt-in-not-required")
                    .build()));
        }
        for (String name : names) {
            if (!RegionCatalog.REGIONS.contains(name)) throw AwsException.MalformedParameter.invalidValue("RegionName", name);
        }
        return items("regionInfo", filter.evaluateAll(rows, Params.filters(params)));
    }

    private ActionResult zones(ValueTree.Mapping params, RequestContext context) {
        List<String> names = Params.texts(params, "ZoneName");
        List<String> ids = Params.texts(params, "ZoneId");
        List<Resource> rows = new ArrayList<>();
        for (RegionCatalog.Zone zone : RegionCatalog.zones(context.region())) {
            if (!names.isEmpty() && !names.contains(zone.name())) continue;
            if (!ids.isEmpty() && !ids.contains(zone.id())) continue;
            rows.add(row(ZONE, zone.name(), ValueTree.Mapping.builder()
                    .put("zoneName", zone.name())
                    .put("zoneId", zone.id())
                    .put("zoneState", "available")
                    .put("regionName", zone.region())
                    .put("groupName", zone.region())
                    .put("networkBorderGroup", zone.region())
                    .put("optInStatus", "opt-in-not-required")
                    .put("zoneType", "availability-zone")
                    .put("messageSet", new ValueTree.Sequence(List.of()))
                    .build()));
        }
        for (String name : names) {
            if (!RegionCatalog.isZone(context.region(), name)) throw AwsException.MalformedParameter.invalidValue("ZoneName", name);
        }
        return items("availabilityZoneInfo", filter.evaluateAll(rows, Params.filters(params)));
    }

    private ActionResult accountAttributes(ValueTree.Mapping params) {
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        attributes.put("supported-platforms", List.of("VPC"));
        attributes.put("default-vpc", List.of(DefaultVpc.find(store).map(Resource::id).orElse("none")));
        attributes.put("max-instances", List.of(Integer.toString(MAX_INSTANCES)));
        attributes.put("vpc-max-security-groups-per-interface", List.of("5"));
        attributes.put("max-elastic-ips", List.of("5"));
        attributes.put("vpc-max-elastic-ips", List.of("5"));

        List<String> requested = Params.texts(params, "AttributeName");
        List<ValueTree> items = new ArrayList<>();
        for (Map.Entry<String, List<String>> a : attributes.entrySet()) {
            if (!requested.isEmpty() && !requested.contains(a.getKey())) continue;
            List<ValueTree> values = new ArrayList<>();
            for (String v : a.getValue()) values.add(ValueTree.Mapping.builder().put("attributeValue", v).build());
            items.add(ValueTree.Mapping.builder()
                    .put("attributeName", a.getKey())
                    .put("attributeValueSet", new ValueTree.Sequence(values))
                    .build());
        }
        for (String name : requested) {
            if (!attributes.containsKey(name)) throw AwsException.MalformedParameter.invalidValue("AttributeName", name);
        }
        return ActionResult.of(ValueTree.Mapping.builder()
                .put("accountAttributeSet", new ValueTree.Sequence(items))
                .build());
    }

    private static Resource row(ResourceType type, String id, ValueTree.Mapping attributes) {
        return new Resource(type, id, attributes, Map.of(), Instant.EPOCH, null);
    }

    private static ActionResult items(String setName, List<Resource> rows) {
        List<ValueTree> items = new ArrayList<>(rows.size());
        for (Resource r : rows) items.add(r.attributes());
        return ActionResult.of(ValueTree.Mapping.builder().put(setName, new ValueTree.Sequence(items)).build());
    }
}
