package io.veraaws.server.core;

import io.veraaws.server.spi.IdGenerator;
import io.veraaws.server.spi.ResourceType;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Generates {@code <prefix>-<hex>} ids with the suffix length of the type's {@link io.veraaws.server.spi.IdFormat}.
 */
public final class RandomHexIdGenerator implements IdGenerator {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final Random random;

    public RandomHexIdGenerator() {
        this(new SecureRandom());
    }

    public RandomHexIdGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String next(ResourceType type) {
        int len = type.idFormat().suffixLength();
        StringBuilder sb = new StringBuilder(type.idPrefix().length() + 1 + len);
        sb.append(type.idPrefix()).append('-');
        for (int i = 0; i < len; i++) {
            sb.append(HEX[random.nextInt(16)]);
        }
        return sb.toString();
    }
}
