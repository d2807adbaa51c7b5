package io.veraaws.server.spi;

import java.util.Objects;

/**
 * Wire conventions of a provider protocol: how requests are encoded, how members are named and
 * how results and errors are wrapped.
 *
 * <p>Serialization is driven entirely by this table; no codec special-cases individual actions.
 */
public record ServiceProtocol(
        String name,
        RequestEncoding requestEncoding,
        String responseContentType,
        MemberCase memberCase,
        String listItemName,
        String listMarker,
        boolean allowSparseIndices,
        Envelope envelope
) {
    public enum RequestEncoding {
        /** Flat {@code Key.N.Sub=value} pairs from the query string or a form body. */
        QUERY,
        /** JSON document body, action named by the {@code X-Amz-Target} header. */
        JSON
    }

    public enum MemberCase {
        LOWER_CAMEL,
        PASCAL
    }

    public enum Envelope {
        /** {@code <ActionResponse><requestId/>...}; errors as {@code <Response><Errors>}. */
        EC2,
        /** {@code <ActionResponse><ActionResult>...<ResponseMetadata>}; errors as {@code <ErrorResponse>}. */
        QUERY,
        /** Plain JSON body; errors as {@code {"__type", "message"}}. */
        JSON
    }

    public static final ServiceProtocol EC2 = new ServiceProtocol(
            "ec2", RequestEncoding.QUERY, "text/xml;charset=UTF-8", MemberCase.LOWER_CAMEL, "item", null, false, Envelope.EC2);

    public static final ServiceProtocol QUERY = new ServiceProtocol(
            "query", RequestEncoding.QUERY, "text/xml;charset=UTF-8", MemberCase.PASCAL, "member", "member", false, Envelope.QUERY);

    public static final ServiceProtocol JSON = new ServiceProtocol(
            "json", RequestEncoding.JSON, "application/x-amz-json-1.1", MemberCase.PASCAL, null, null, false, Envelope.JSON);

    public ServiceProtocol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(requestEncoding, "requestEncoding");
        Objects.requireNonNull(responseContentType, "responseContentType");
        Objects.requireNonNull(memberCase, "memberCase");
        Objects.requireNonNull(envelope, "envelope");
    }

    /** Applies this protocol's member casing to a member name. */
    public String memberName(String name) {
        if (name == null || name.isEmpty()) return name;
        char first = name.charAt(0);
        return switch (memberCase) {
            case LOWER_CAMEL -> Character.isUpperCase(first) ? Character.toLowerCase(first) + name.substring(1) : name;
            case PASCAL -> Character.isLowerCase(first) ? Character.toUpperCase(first) + name.substring(1) : name;
        };
    }
}
