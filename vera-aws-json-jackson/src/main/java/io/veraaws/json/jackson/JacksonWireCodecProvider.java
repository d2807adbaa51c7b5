package io.veraaws.json.jackson;

import io.veraaws.core.Protocol;
import io.veraaws.server.spi.WireCodec;
import io.veraaws.server.spi.WireCodecProvider;

import java.util.List;

public final class JacksonWireCodecProvider implements WireCodecProvider {
    @Override
    public List<WireCodec> codecs() {
        return List.of(
                new JacksonXmlWireCodec(),
                new JacksonJsonWireCodec(Protocol.CT_AMZ_JSON_1_0),
                new JacksonJsonWireCodec(Protocol.CT_AMZ_JSON_1_1));
    }
}
