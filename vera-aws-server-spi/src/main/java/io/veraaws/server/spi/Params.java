package io.veraaws.server.spi;

import io.veraaws.core.AwsException;
import io.veraaws.core.Protocol;
import io.veraaws.core.ValueTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to decoded request parameters, shared by all handlers.
 *
 * <p>Every accessor reports shape problems as {@link AwsException.MalformedParameter} so handlers
 * never see a raw {@link ClassCastException} or {@link NumberFormatException}.
 */
public final class Params {
    private Params() {}

    public static String require(ValueTree.Mapping params, String name) {
        return text(params, name).orElseThrow(() -> AwsException.MalformedParameter.missing(name));
    }

    public static Optional<String> text(ValueTree.Mapping params, String name) {
        ValueTree v = params.get(name);
        if (v == null) return Optional.empty();
        if (!(v instanceof ValueTree.Scalar s)) {
            throw new AwsException.MalformedParameter("Parameter " + name + " must be a single value");
        }
        String text = s.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public static boolean flag(ValueTree.Mapping params, String name) {
        Optional<String> v = text(params, name);
        if (v.isEmpty()) return false;
        String s = v.get().toLowerCase(Locale.ROOT);
        if (s.equals("true")) return true;
        if (s.equals("false")) return false;
        throw AwsException.MalformedParameter.invalidValue(name, v.get());
    }

    public static Optional<Integer> integer(ValueTree.Mapping params, String name) {
        Optional<String> v = text(params, name);
        if (v.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(v.get()));
        } catch (NumberFormatException e) {
            throw AwsException.MalformedParameter.invalidValue(name, v.get());
        }
    }

    /**
     * Values of a list parameter such as {@code VpcId.1}, {@code VpcId.2}. A single value counts as a
     * one-element list.
     */
    public static List<String> texts(ValueTree.Mapping params, String name) {
        List<String> out = new ArrayList<>();
        for (ValueTree item : params.sequence(name)) {
            if (!(item instanceof ValueTree.Scalar s)) {
                throw new AwsException.MalformedParameter("Parameter " + name + " must be a list of values");
            }
            out.add(s.asText());
        }
        return out;
    }

    /**
     * Nested structures of a list parameter such as {@code IpPermissions.1.FromPort}.
     */
    public static List<ValueTree.Mapping> mappings(ValueTree.Mapping params, String name) {
        List<ValueTree.Mapping> out = new ArrayList<>();
        int i = 1;
        for (ValueTree item : params.sequence(name)) {
            if (!(item instanceof ValueTree.Mapping m)) {
                throw new AwsException.MalformedParameter("Parameter " + name + "." + i + " must be a structure");
            }
            out.add(m);
            i++;
        }
        return out;
    }

    /** {@code Filter.N.Name} / {@code Filter.N.Value.M} pairs. */
    public static List<FilterSpec> filters(ValueTree.Mapping params) {
        List<FilterSpec> out = new ArrayList<>();
        for (ValueTree.Mapping f : mappings(params, Protocol.P_FILTER)) {
            int index = out.size() + 1;
            String name = text(f, "Name").orElseThrow(() -> AwsException.MalformedParameter.missing("Filter." + index + ".Name"));
            out.add(new FilterSpec(name, texts(f, "Value")));
        }
        return out;
    }

    /** {@code <name>.N.Key} / {@code <name>.N.Value} pairs, later keys overwrite earlier ones. */
    public static Map<String, String> tags(ValueTree.Mapping params, String name) {
        Map<String, String> out = new LinkedHashMap<>();
        for (ValueTree.Mapping t : mappings(params, name)) {
            String key = text(t, "Key").orElseThrow(() -> AwsException.MalformedParameter.missing(name + ".Key"));
            ValueTree value = t.get("Value");
            out.put(key, value == null ? "" : value.text().orElse(""));
        }
        return out;
    }

    /**
     * Tags requested through {@code TagSpecification.N} for the given provider resource type name.
     */
    public static Map<String, String> tagSpecifications(ValueTree.Mapping params, String resourceType) {
        Map<String, String> out = new LinkedHashMap<>();
        for (ValueTree.Mapping spec : mappings(params, Protocol.P_TAG_SPECIFICATION)) {
            String type = text(spec, "ResourceType").orElse(resourceType);
            if (!type.equals(resourceType)) continue;
            out.putAll(tags(spec, "Tag"));
        }
        return out;
    }

    /**
     * @throws AwsException.DryRunOperation when {@code DryRun=true}
     */
    public static void checkDryRun(ValueTree.Mapping params) {
        if (flag(params, Protocol.P_DRY_RUN)) {
            throw new AwsException.DryRunOperation();
        }
    }
}
