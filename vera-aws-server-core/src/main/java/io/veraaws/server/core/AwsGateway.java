package io.veraaws.server.core;

import io.veraaws.core.AwsException;
import io.veraaws.core.Protocol;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.server.spi.ServiceProtocol;
import io.veraaws.server.spi.WireCodec;
import io.veraaws.server.spi.WireCodecRegistry;
import io.veraaws.server.spi.WireError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Framework-neutral gateway: decodes a provider request, routes it to the registered handler and
 * encodes the handler's result or error in the service's wire format.
 *
 * <p>The gateway never looks at resource semantics. Every {@link AwsException} and every other
 * runtime failure raised while handling a request ends up in the provider error envelope.
 *
 * <p>Use {@link #builder(ActionRegistry, WireCodecRegistry)}:
 * <pre>{@code
 * AwsGateway gateway = AwsGateway.builder(actions, ServiceLoaderCodecRegistry.defaultRegistry())
 *     .region("us-east-1")
 *     .accountId("000000000000")
 *     .maxBodySize(10 * 1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class AwsGateway {

    private static final Logger log = LoggerFactory.getLogger(AwsGateway.class);

    /**
     * Disable body size limiting (unlimited).
     */
    public static final long NO_BODY_SIZE_LIMIT = Long.MAX_VALUE;

    private final ActionRegistry actions;
    private final WireCodecRegistry codecs;
    private final ServiceDefinition defaultService;
    private final Clock clock;
    private final Supplier<String> requestIds;
    private final String region;
    private final String accountId;
    private final long maxBodySize;
    private final Map<ServiceProtocol, ParameterDecoder> decoders = new HashMap<>();

    public static Builder builder(ActionRegistry actions, WireCodecRegistry codecs) {
        return new Builder(actions, codecs);
    }

    private AwsGateway(Builder b) {
        this.actions = b.actions;
        this.codecs = b.codecs;
        this.defaultService = actions.service(b.defaultService).orElseThrow(() ->
                new IllegalStateException("default service " + b.defaultService + " is not registered"));
        this.clock = b.clock;
        this.requestIds = b.requestIds;
        this.region = b.region;
        this.accountId = b.accountId;
        this.maxBodySize = b.maxBodySize > 0 ? b.maxBodySize : NO_BODY_SIZE_LIMIT;
        for (ServiceDefinition svc : actions.services()) {
            ServiceProtocol protocol = svc.protocol();
            if (codecs.find(protocol.responseContentType()).isEmpty()) {
                throw new IllegalStateException("no wire codec for " + protocol.responseContentType()
                        + " (service " + svc.name() + ")");
            }
            decoders.putIfAbsent(protocol, new ParameterDecoder(protocol));
        }
    }

    /**
     * Builder for {@link AwsGateway}.
     */
    public static final class Builder {
        private final ActionRegistry actions;
        private final WireCodecRegistry codecs;
        private String defaultService = Protocol.DEFAULT_SERVICE;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> requestIds = () -> UUID.randomUUID().toString();
        private String region = "us-east-1";
        private String accountId = "000000000000";
        private long maxBodySize;

        private Builder(ActionRegistry actions, WireCodecRegistry codecs) {
            this.actions = Objects.requireNonNull(actions, "actions");
            this.codecs = Objects.requireNonNull(codecs, "codecs");
        }

        /** Service assumed when the request names none. Default: {@code ec2}. */
        public Builder defaultService(String defaultService) {
            this.defaultService = Objects.requireNonNull(defaultService, "defaultService");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Source of request-correlation ids. Default: random UUIDs. */
        public Builder requestIds(Supplier<String> requestIds) {
            this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
            return this;
        }

        /** Region used when the request is not signed with one. */
        public Builder region(String region) {
            this.region = Objects.requireNonNull(region, "region");
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = Objects.requireNonNull(accountId, "accountId");
            return this;
        }

        /** Maximum request body size in bytes. Default: unlimited. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        public AwsGateway build() {
            return new AwsGateway(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        String requestId = requestIds.get();
        Instant receivedAt = clock.instant();
        ServiceDefinition service = defaultService;
        try {
            if (!req.isApiMethod()) {
                return ServerResponse.methodNotAllowed(requestId);
            }
            byte[] body = BodyReader.readAll(req.body(), maxBodySize);

            String action;
            ValueTree.Mapping params;
            Optional<String> target = req.target();
            if (target.isPresent()) {
                String t = target.get();
                int dot = t.lastIndexOf('.');
                if (dot <= 0 || dot == t.length() - 1) {
                    throw new AwsException.MalformedParameter("MissingAction", "Malformed " + Protocol.H_AMZ_TARGET + " header: " + t);
                }
                String prefix = t.substring(0, dot);
                action = t.substring(dot + 1);
                Optional<ServiceDefinition> svc = actions.serviceForTarget(prefix);
                if (svc.isEmpty()) {
                    service = new ServiceDefinition(prefix, ServiceProtocol.JSON, null, prefix, Set.of());
                    throw new AwsException.UnsupportedAction(prefix, action);
                }
                service = svc.get();
                params = body.length == 0 ? ValueTree.Mapping.empty() : codec(service).decodeBody(body);
            } else {
                String name = req.signedService().orElse(defaultService.name());
                Map<String, List<String>> raw = queryParameters(req, body);
                action = lastValue(raw, Protocol.P_ACTION);
                Optional<ServiceDefinition> svc = actions.service(name);
                if (svc.isEmpty()) {
                    throw new AwsException.UnsupportedAction(name, action == null ? "" : action);
                }
                service = svc.get();
                if (action == null || action.isEmpty()) {
                    throw new AwsException.MalformedParameter("MissingAction", "The request must contain the parameter Action");
                }
                raw.remove(Protocol.P_ACTION);
                raw.remove(Protocol.P_VERSION);
                params = decoders.get(service.protocol()).decode(raw);
            }

            String serviceName = service.name();
            ActionHandler handler = actions.resolve(serviceName, action)
                    .orElseThrow(() -> new AwsException.UnsupportedAction(serviceName, action));

            String signedRegion = req.signedRegion().orElse(region);
            RequestContext ctx = new RequestContext(requestId, serviceName, action, signedRegion, accountId, receivedAt);
            log.debug("[{}] {}:{}", requestId, serviceName, action);

            ActionResult result = handler.handle(action, params, ctx);
            if (result.shape() == ActionResult.Shape.ERROR) {
                WireError error = new WireError(
                        result.body().text("Code").orElse("InternalError"),
                        result.body().text("Message").orElse(""),
                        400);
                log.debug("[{}] {}:{} failed: {} {}", requestId, serviceName, action, error.code(), error.message());
                return errorResponse(service, error, requestId);
            }

            byte[] bytes = codec(service).encodeResult(service, action, result.body(), requestId);
            return ServerResponse.encoded(200, service.protocol().responseContentType(), bytes, requestId);
        } catch (BodyReader.PayloadTooLargeException ptle) {
            return errorResponse(service, new WireError("RequestEntityTooLarge",
                    "Request body exceeds " + ptle.maxBytes() + " bytes", 413), requestId);
        } catch (IOException ioe) {
            log.debug("[{}] failed to read request body", requestId, ioe);
            return errorResponse(service, new WireError("IncompleteBody", "The request body could not be read", 400), requestId);
        } catch (AwsException e) {
            if (e.isClientError()) {
                log.debug("[{}] {} {}", requestId, e.errorCode(), e.getMessage());
            } else {
                log.error("[{}] {} {}", requestId, e.errorCode(), e.getMessage(), e);
            }
            return errorResponse(service, new WireError(e.errorCode(), e.getMessage(), e.httpStatus()), requestId);
        } catch (RuntimeException e) {
            log.error("[{}] unhandled failure", requestId, e);
            return errorResponse(service, new WireError("InternalError", "An internal error has occurred", 500), requestId);
        }
    }

    public ActionRegistry actions() {
        return actions;
    }

    private ServerResponse errorResponse(ServiceDefinition service, WireError error, String requestId) {
        ServiceDefinition target = codecs.find(service.protocol().responseContentType()).isPresent() ? service : defaultService;
        byte[] bytes = codec(target).encodeError(target, error, requestId);
        return ServerResponse.encoded(error.httpStatus(), target.protocol().responseContentType(), bytes, requestId);
    }

    private WireCodec codec(ServiceDefinition service) {
        String ct = service.protocol().responseContentType();
        return codecs.find(ct).orElseThrow(() -> new IllegalStateException("no wire codec for " + ct));
    }

    private static Map<String, List<String>> queryParameters(ServerRequest req, byte[] body) {
        Map<String, List<String>> raw = new LinkedHashMap<>(req.queryParameters());
        if (body.length > 0 && req.hasFormBody()) {
            raw.putAll(QueryString.parse(new String(body, StandardCharsets.UTF_8)));
        }
        return raw;
    }

    private static String lastValue(Map<String, List<String>> raw, String key) {
        List<String> values = raw.get(key);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
