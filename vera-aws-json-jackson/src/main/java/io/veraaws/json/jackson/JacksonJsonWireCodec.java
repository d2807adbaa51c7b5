package io.veraaws.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.server.spi.WireCodec;
import io.veraaws.server.spi.WireCodecException;
import io.veraaws.server.spi.WireError;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON protocol codec: the body is the document itself, errors are {@code {"__type", "message"}}.
 */
public final class JacksonJsonWireCodec implements WireCodec {
    private final String contentType;
    private final ObjectMapper mapper;

    public JacksonJsonWireCodec(String contentType) {
        this(contentType, new ObjectMapper());
    }

    public JacksonJsonWireCodec(String contentType, ObjectMapper mapper) {
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String contentType() {
        return contentType;
    }

    @Override
    public byte[] encodeResult(ServiceDefinition service, String action, ValueTree.Mapping body, String requestId) {
        try {
            return mapper.writeValueAsBytes(JacksonValueTrees.toJson(body, service.protocol()));
        } catch (JsonProcessingException e) {
            throw new WireCodecException("Failed to serialize " + action + " result", e);
        }
    }

    @Override
    public byte[] encodeError(ServiceDefinition service, WireError error, String requestId) {
        ObjectNode node = mapper.createObjectNode();
        node.put("__type", error.code());
        node.put("message", error.message());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new WireCodecException("Failed to serialize error " + error.code(), e);
        }
    }

    @Override
    public ValueTree.Mapping decodeBody(byte[] body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (IOException e) {
            throw new AwsException.MalformedParameter("SerializationException", "Request body is not valid JSON");
        }
        return JacksonValueTrees.toMapping(node);
    }
}
