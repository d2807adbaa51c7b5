package io.veraaws.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-request information handed to handlers next to the decoded parameters.
 */
public record RequestContext(String requestId, String service, String action, String region, String accountId, Instant receivedAt) {
    public RequestContext {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }
}
