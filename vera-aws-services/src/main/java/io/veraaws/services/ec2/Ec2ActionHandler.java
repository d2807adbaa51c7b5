package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Pagination;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ResourceType;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class of the EC2 handlers: action table, id-list plus filter selection, paging and the
 * parts of the rendering every resource shares.
 */
abstract class Ec2ActionHandler implements ActionHandler {

    protected final ResourceStore store;
    protected final ResourceFilter filter;
    private final Set<String> actions;

    protected Ec2ActionHandler(ResourceStore store, ResourceFilter filter, String... actions) {
        this.store = Objects.requireNonNull(store, "store");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(actions)));
    }

    @Override
    public String service() {
        return Ec2Service.NAME;
    }

    @Override
    public Set<String> actions() {
        return actions;
    }

    @Override
    public final ActionResult handle(String action, ValueTree.Mapping params, RequestContext context) {
        if (!actions.contains(action)) {
            throw new AwsException.UnsupportedAction(service(), action);
        }
        return dispatch(action, params, context);
    }

    protected abstract ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context);

    /**
     * Resources named by the {@code idParameter} list (all of them when it is absent) that pass the
     * request's filters. A requested id that does not exist fails with the type's not-found code.
     */
    protected List<Resource> select(ResourceType type, ValueTree.Mapping params, String idParameter) {
        List<String> ids = Params.texts(params, idParameter);
        List<Resource> candidates;
        if (ids.isEmpty()) {
            candidates = store.list(type);
        } else {
            candidates = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) candidates.add(store.get(type, id));
        }
        return filter.evaluateAll(candidates, Params.filters(params));
    }

    /** One page of {@code resources}, rendered into {@code setName}, with {@code nextToken} when more remain. */
    protected static ActionResult page(List<Resource> resources, ValueTree.Mapping params, String setName,
                                       Function<Resource, ValueTree> render) {
        Pagination.Page<Resource> page = Pagination.page(resources, params);
        List<ValueTree> items = new ArrayList<>(page.items().size());
        for (Resource r : page.items()) items.add(render.apply(r));
        return ActionResult.of(ValueTree.Mapping.builder()
                .put(setName, new ValueTree.Sequence(items))
                .put("nextToken", page.nextToken().orElse(null))
                .build());
    }

    /** Id member, stored attributes, then the tag set. */
    protected static ValueTree.Mapping.Builder render(Resource r, String idMember) {
        return ValueTree.Mapping.builder()
                .put(idMember, r.id())
                .putAll(r.attributes())
                .put("tagSet", tagSet(r));
    }

    protected static ValueTree.Sequence tagSet(Resource r) {
        List<ValueTree> items = new ArrayList<>(r.tags().size());
        for (Map.Entry<String, String> t : r.tags().entrySet()) {
            items.add(ValueTree.Mapping.builder().put("key", t.getKey()).put("value", t.getValue()).build());
        }
        return new ValueTree.Sequence(items);
    }

    protected static String timestamp(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    /** Ids given as {@code Name.N}; at least one is required. */
    protected static List<String> requireIds(ValueTree.Mapping params, String name) {
        List<String> ids = Params.texts(params, name);
        if (ids.isEmpty()) throw AwsException.MalformedParameter.missing(name);
        return ids;
    }
}
