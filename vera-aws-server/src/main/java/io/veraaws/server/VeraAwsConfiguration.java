package io.veraaws.server;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Server settings, read from system properties, environment variables and
 * {@code META-INF/microprofile-config.properties}.
 *
 * <pre>
 * vera.port=5003
 * vera.region=eu-west-1
 * VERA_DEFAULT_VPC=false
 * </pre>
 */
@ConfigMapping(prefix = "vera")
public interface VeraAwsConfiguration {

    @WithDefault("5003")
    int port();

    @WithDefault("0.0.0.0")
    String host();

    /**
     * Region reported when a request's credential scope does not name one; the default VPC and
     * availability zones are built for it.
     */
    @WithDefault("us-east-1")
    String region();

    @WithDefault("000000000000")
    String accountId();

    /**
     * Whether to create the default VPC with its subnets and internet gateway at boot.
     */
    @WithDefault("true")
    boolean defaultVpc();

    /**
     * Largest accepted request body in bytes.
     */
    @WithDefault("10485760")
    long maxBodySize();
}
