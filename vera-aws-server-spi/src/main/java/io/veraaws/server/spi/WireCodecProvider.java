package io.veraaws.server.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link WireCodec}.
 *
 * <p>Modules such as {@code vera-aws-json-jackson} register implementations via
 * {@code META-INF/services}.
 */
public interface WireCodecProvider {
    List<WireCodec> codecs();
}
