package io.veraaws.server.spi;

import java.util.List;
import java.util.Objects;

/**
 * One provider filter: a name such as {@code instance-type} or {@code tag:Name} and the values
 * any of which may match.
 */
public record FilterSpec(String name, List<String> values) {
    public FilterSpec {
        Objects.requireNonNull(name, "name");
        values = List.copyOf(values);
    }

    public static FilterSpec of(String name, String... values) {
        return new FilterSpec(name, List.of(values));
    }
}
