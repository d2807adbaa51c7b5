package io.veraaws.core;

/**
 * Provider wire protocol constants (parameter keys, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP server bindings. It only models protocol-level
 * concerns that are shared by the gateway, the codecs and the resource handlers.
 */
public final class Protocol {
    private Protocol() {}

    // Query protocol parameter keys
    public static final String P_ACTION = "Action";
    public static final String P_VERSION = "Version";
    public static final String P_DRY_RUN = "DryRun";
    public static final String P_FILTER = "Filter";
    public static final String P_MAX_RESULTS = "MaxResults";
    public static final String P_NEXT_TOKEN = "NextToken";
    public static final String P_TAG_SPECIFICATION = "TagSpecification";

    // Request/response headers
    public static final String H_AMZ_TARGET = "X-Amz-Target";
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_REQUEST_ID = "x-amzn-RequestId";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_FORM = "application/x-www-form-urlencoded";
    public static final String CT_XML = "text/xml";
    public static final String CT_JSON = "application/json";
    public static final String CT_AMZ_JSON_1_0 = "application/x-amz-json-1.0";
    public static final String CT_AMZ_JSON_1_1 = "application/x-amz-json-1.1";

    // EC2 API
    public static final String EC2_API_VERSION = "2016-11-15";
    public static final String EC2_NAMESPACE = "http://ec2.amazonaws.com/doc/" + EC2_API_VERSION + "/";

    /** Service assumed when neither a target header nor a signed credential scope names one. */
    public static final String DEFAULT_SERVICE = "ec2";
}
