package io.veraaws.json.jackson;

import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import io.veraaws.core.Protocol;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.server.spi.ServiceProtocol;
import io.veraaws.server.spi.WireCodec;
import io.veraaws.server.spi.WireCodecException;
import io.veraaws.server.spi.WireError;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

/**
 * XML codec for the EC2 and query protocols, streaming through Jackson's {@link ToXmlGenerator}.
 *
 * <p>Member names are cased by the service protocol and sequences are written as repeated
 * {@link ServiceProtocol#listItemName()} elements ({@code item} for EC2, {@code member} for query).
 */
public final class JacksonXmlWireCodec implements WireCodec {
    private final XmlFactory factory;

    public JacksonXmlWireCodec() {
        this(XmlMapper.builder().enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION).build());
    }

    public JacksonXmlWireCodec(XmlMapper mapper) {
        this.factory = mapper.getFactory();
    }

    @Override
    public String contentType() {
        return Protocol.CT_XML;
    }

    @Override
    public byte[] encodeResult(ServiceDefinition service, String action, ValueTree.Mapping body, String requestId) {
        ServiceProtocol protocol = service.protocol();
        return write(service.xmlNamespace(), action + "Response", gen -> {
            if (protocol.envelope() == ServiceProtocol.Envelope.QUERY) {
                gen.writeFieldName(action + "Result");
                writeMapping(gen, body, protocol);
                gen.writeFieldName("ResponseMetadata");
                gen.writeStartObject();
                gen.writeStringField("RequestId", requestId);
                gen.writeEndObject();
            } else {
                gen.writeStringField("requestId", requestId);
                writeFields(gen, body, protocol);
            }
        });
    }

    @Override
    public byte[] encodeError(ServiceDefinition service, WireError error, String requestId) {
        if (service.protocol().envelope() == ServiceProtocol.Envelope.QUERY) {
            return write(service.xmlNamespace(), "ErrorResponse", gen -> {
                gen.writeFieldName("Error");
                gen.writeStartObject();
                gen.writeStringField("Type", error.faultType());
                gen.writeStringField("Code", error.code());
                gen.writeStringField("Message", error.message());
                gen.writeEndObject();
                gen.writeStringField("RequestId", requestId);
            });
        }
        return write(null, "Response", gen -> {
            gen.writeFieldName("Errors");
            gen.writeStartObject();
            gen.writeFieldName("Error");
            gen.writeStartObject();
            gen.writeStringField("Code", error.code());
            gen.writeStringField("Message", error.message());
            gen.writeEndObject();
            gen.writeEndObject();
            gen.writeStringField("RequestID", requestId);
        });
    }

    private interface Body {
        void write(ToXmlGenerator gen) throws IOException;
    }

    private byte[] write(String namespace, String rootName, Body body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String ns = namespace == null ? "" : namespace;
        try (ToXmlGenerator gen = factory.createGenerator(out)) {
            if (!ns.isEmpty()) {
                gen.getStaxWriter().setDefaultNamespace(ns);
            }
            gen.initGenerator();
            gen.setNextName(new QName(ns, rootName));
            gen.writeStartObject();
            body.write(gen);
            gen.writeEndObject();
        } catch (IOException | XMLStreamException e) {
            throw new WireCodecException("Failed to write " + rootName, e);
        }
        return out.toByteArray();
    }

    private static void writeMapping(ToXmlGenerator gen, ValueTree.Mapping mapping, ServiceProtocol protocol) throws IOException {
        gen.writeStartObject();
        writeFields(gen, mapping, protocol);
        gen.writeEndObject();
    }

    private static void writeFields(ToXmlGenerator gen, ValueTree.Mapping mapping, ServiceProtocol protocol) throws IOException {
        for (Map.Entry<String, ValueTree> e : mapping.fields().entrySet()) {
            gen.writeFieldName(protocol.memberName(e.getKey()));
            writeValue(gen, e.getValue(), protocol);
        }
    }

    private static void writeValue(ToXmlGenerator gen, ValueTree value, ServiceProtocol protocol) throws IOException {
        if (value instanceof ValueTree.Mapping m) {
            writeMapping(gen, m, protocol);
        } else if (value instanceof ValueTree.Sequence s) {
            String itemName = protocol.listItemName() == null ? "item" : protocol.listItemName();
            gen.writeStartObject();
            for (ValueTree item : s.items()) {
                gen.writeFieldName(itemName);
                writeValue(gen, item, protocol);
            }
            gen.writeEndObject();
        } else {
            gen.writeString(((ValueTree.Scalar) value).asText());
        }
    }
}
