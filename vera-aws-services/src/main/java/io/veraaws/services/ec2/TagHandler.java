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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tag operations that address resources of any type by id.
 */
final class TagHandler extends Ec2ActionHandler {

    /** One row of {@code DescribeTags}; never stored. */
    static final ResourceType TAG_ROW = ResourceType.builder("tag")
            .filter("key", "key")
            .filter("value", "value")
            .filter("resource-id", "resourceId")
            .filter("resource-type", "resourceType")
            .build();

    TagHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateTags", "DeleteTags", "DescribeTags");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateTags" -> create(params);
            case "DeleteTags" -> delete(params);
            case "DescribeTags" -> describe(params);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params) {
        List<String> ids = resourceIds(params);
        Map<String, String> tags = Params.tags(params, "Tag");
        if (tags.isEmpty()) throw AwsException.MalformedParameter.missing("Tag");
        Params.checkDryRun(params);
        for (String id : ids) store.tagResource(id, tags);
        return ActionResult.ok();
    }

    private ActionResult delete(ValueTree.Mapping params) {
        List<String> ids = resourceIds(params);
        List<ValueTree.Mapping> requested = Params.mappings(params, "Tag");
        Params.checkDryRun(params);
        for (String id : ids) {
            Resource resource = store.lookup(id).orElseThrow(() -> notFound(id));
            List<String> keys = new ArrayList<>();
            if (requested.isEmpty()) {
                keys.addAll(resource.tags().keySet());
            }
            for (ValueTree.Mapping tag : requested) {
                String key = Params.require(tag, "Key");
                // a Value, even empty, must match; no Value removes the key whatever its value
                Optional<String> value = tag.has("Value") ? Optional.of(tag.text("Value").orElse("")) : Optional.empty();
                String current = resource.tags().get(key);
                if (current != null && value.map(current::equals).orElse(true)) keys.add(key);
            }
            if (!keys.isEmpty()) store.untagResource(id, keys);
        }
        return ActionResult.ok();
    }

    private ActionResult describe(ValueTree.Mapping params) {
        List<Resource> rows = new ArrayList<>();
        for (ResourceType type : store.types().all()) {
            for (Resource r : store.list(type)) {
                for (Map.Entry<String, String> tag : r.tags().entrySet()) {
                    ValueTree.Mapping row = ValueTree.Mapping.builder()
                            .put("resourceId", r.id())
                            .put("resourceType", type.name())
                            .put("key", tag.getKey())
                            .put("value", tag.getValue())
                            .build();
                    rows.add(new Resource(TAG_ROW, r.id() + "/" + tag.getKey(), row, Map.of(), r.createdAt(), null));
                }
            }
        }
        return page(filter.evaluateAll(rows, Params.filters(params)), params, "tagSet", Resource::attributes);
    }

    /** Requested ids, all checked to exist before any tag changes. */
    private List<String> resourceIds(ValueTree.Mapping params) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(requireIds(params, "ResourceId")));
        for (String id : ids) {
            if (store.lookup(id).isEmpty()) throw notFound(id);
        }
        return ids;
    }

    private AwsException notFound(String id) {
        for (ResourceType type : store.types().all()) {
            if (id.startsWith(type.idPrefix() + "-")) {
                return new AwsException.NotFound(type.notFoundCode(), type.name(), id);
            }
        }
        return new AwsException.NotFound("InvalidID", "resource", id);
    }
}
