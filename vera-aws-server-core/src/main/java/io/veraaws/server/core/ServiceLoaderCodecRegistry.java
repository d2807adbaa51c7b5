package io.veraaws.server.core;

import io.veraaws.server.spi.WireCodec;
import io.veraaws.server.spi.WireCodecProvider;
import io.veraaws.server.spi.WireCodecRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link WireCodecRegistry} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Picks up every {@link WireCodecProvider} on the class path, e.g. the Jackson XML and JSON
 * codecs from {@code vera-aws-json-jackson}.
 */
public final class ServiceLoaderCodecRegistry implements WireCodecRegistry {

    private final Map<String, WireCodec> byContentType;

    public ServiceLoaderCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<String, WireCodec> map = new HashMap<>();

        ServiceLoader<WireCodecProvider> loader = ServiceLoader.load(WireCodecProvider.class, cl);
        for (WireCodecProvider p : loader) {
            for (WireCodec c : p.codecs()) {
                if (c == null || c.contentType() == null) continue;
                String normalized = WireCodecRegistry.normalizeContentType(c.contentType());
                if (!normalized.isEmpty()) {
                    map.put(normalized, c);
                }
            }
        }
        this.byContentType = Map.copyOf(map);
    }

    public static ServiceLoaderCodecRegistry defaultRegistry() {
        return new ServiceLoaderCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<WireCodec> find(String contentType) {
        String normalized = WireCodecRegistry.normalizeContentType(contentType);
        if (normalized.isEmpty()) return Optional.empty();
        return Optional.ofNullable(byContentType.get(normalized));
    }
}
