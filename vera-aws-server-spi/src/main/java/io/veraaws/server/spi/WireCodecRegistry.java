package io.veraaws.server.spi;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry that resolves a {@link WireCodec} for a given content type.
 *
 * <p>Use {@link #builder()} to register codecs explicitly:
 * <pre>{@code
 * WireCodecRegistry registry = WireCodecRegistry.builder()
 *     .register(new JacksonXmlWireCodec())
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface WireCodecRegistry {

    /**
     * Find a codec for the given content type; parameters such as {@code charset} are ignored.
     */
    Optional<WireCodec> find(String contentType);

    static Builder builder() {
        return new Builder();
    }

    static String normalizeContentType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for a {@link WireCodecRegistry} with explicit codec registration.
     */
    final class Builder {
        private final Map<String, WireCodec> codecs = new HashMap<>();

        private Builder() {}

        public Builder register(WireCodec codec) {
            Objects.requireNonNull(codec, "codec");
            String ct = codec.contentType();
            if (ct == null || ct.isBlank()) {
                throw new IllegalArgumentException("codec contentType must not be null or blank");
            }
            codecs.put(normalizeContentType(ct), codec);
            return this;
        }

        public Builder registerAll(Iterable<? extends WireCodec> codecs) {
            for (WireCodec codec : codecs) {
                register(codec);
            }
            return this;
        }

        public WireCodecRegistry build() {
            Map<String, WireCodec> snapshot = Map.copyOf(codecs);
            return contentType -> {
                String normalized = normalizeContentType(contentType);
                if (normalized.isEmpty()) return Optional.empty();
                return Optional.ofNullable(snapshot.get(normalized));
            };
        }
    }
}
