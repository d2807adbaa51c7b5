package io.veraaws.server;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.veraaws.server.core.ActionRegistry;
import io.veraaws.server.core.AwsGateway;
import io.veraaws.server.core.FilterEvaluator;
import io.veraaws.server.core.HttpMethod;
import io.veraaws.server.core.InMemoryResourceStore;
import io.veraaws.server.core.ResponseBody;
import io.veraaws.server.core.ServerRequest;
import io.veraaws.server.core.ServerResponse;
import io.veraaws.server.core.ServiceLoaderCodecRegistry;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.services.Services;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standalone server: one in-memory account behind a Javalin listener.
 */
public final class VeraAwsServer {

    private static final Logger log = LoggerFactory.getLogger(VeraAwsServer.class);

    private final VeraAwsConfiguration config;
    private final ActionRegistry registry;
    private final AwsGateway gateway;
    private Javalin app;

    public VeraAwsServer(VeraAwsConfiguration config) {
        this.config = config;
        if (config.port() < 0 || config.port() > 65535) {
            throw new IllegalArgumentException("vera.port out of range: " + config.port());
        }

        ResourceStore store = new InMemoryResourceStore(Services.resourceTypes());
        ActionRegistry.Builder actions = ActionRegistry.builder();
        for (ServiceDefinition service : Services.definitions()) actions.service(service);
        this.registry = actions.handlers(Services.handlers(store, new FilterEvaluator())).build();

        if (config.defaultVpc()) {
            Services.bootstrap(store, config.region(), config.accountId());
        }

        this.gateway = AwsGateway.builder(registry, ServiceLoaderCodecRegistry.defaultRegistry())
                .region(config.region())
                .accountId(config.accountId())
                .maxBodySize(config.maxBodySize())
                .build();
    }

    public static void main(String[] args) {
        VeraAwsServer server = new VeraAwsServer(configuration(Map.of()));
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "vera-aws-shutdown"));
    }

    /** Configuration from the default sources, with {@code overrides} taking precedence. */
    public static VeraAwsConfiguration configuration(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "overrides", 1000))
                .withMapping(VeraAwsConfiguration.class)
                .build();
        return config.getConfigMapping(VeraAwsConfiguration.class);
    }

    public VeraAwsServer start() {
        app = Javalin.create(javalin -> javalin.showJavalinBanner = false);
        app.get("/health", this::health);
        app.get("/", this::handle);
        app.post("/", this::handle);
        app.start(config.host(), config.port());
        log.info("Serving {} services / {} actions on http://{}:{} (region {}, account {})",
                registry.services().size(), registry.actionCount(), config.host(), app.port(),
                config.region(), config.accountId());
        return this;
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    /** Bound port; differs from the configured one when that is {@code 0}. */
    public int port() {
        if (app == null) throw new IllegalStateException("server not started");
        return app.port();
    }

    private void health(Context ctx) {
        Map<String, String> services = new LinkedHashMap<>();
        for (ServiceDefinition service : registry.services()) services.put(service.name(), "running");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "running");
        body.put("services", services);
        ctx.json(body);
    }

    private void handle(Context ctx) {
        ServerRequest request = new ServerRequest(
                HttpMethod.valueOf(ctx.method().name()),
                URI.create(ctx.fullUrl()),
                toHeaders(ctx),
                bodyOrNull(ctx));

        ServerResponse response = gateway.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }
        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        }
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    private static InputStream bodyOrNull(Context ctx) {
        long len = ctx.req().getContentLengthLong();
        if (len == 0) return null;
        return ctx.bodyInputStream();
    }
}
