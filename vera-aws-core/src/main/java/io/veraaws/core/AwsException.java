package io.veraaws.core;

import java.util.Objects;

/**
 * Base class for errors surfaced to API clients.
 *
 * <p>Every subclass carries the provider error code (for example {@code InvalidVpcID.NotFound})
 * and the HTTP status the gateway answers with. The gateway is the only place these are turned
 * into wire envelopes.
 */
public abstract class AwsException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    protected AwsException(String errorCode, int httpStatus, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.httpStatus = httpStatus;
    }

    protected AwsException(String errorCode, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.httpStatus = httpStatus;
    }

    public String errorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** True for every category except {@link Internal}. */
    public boolean isClientError() {
        return httpStatus < 500;
    }

    /**
     * Raised when request parameters cannot be decoded or a required parameter is missing or
     * has the wrong shape.
     */
    public static class MalformedParameter extends AwsException {
        public MalformedParameter(String message) {
            this("InvalidParameterValue", message);
        }

        public MalformedParameter(String errorCode, String message) {
            super(errorCode, 400, message);
        }

        public static MalformedParameter missing(String parameter) {
            return new MalformedParameter("MissingParameter",
                    "The request must contain the parameter " + parameter);
        }

        public static MalformedParameter invalidValue(String parameter, String value) {
            return new MalformedParameter("InvalidParameterValue",
                    "Value (" + value + ") for parameter " + parameter + " is invalid.");
        }
    }

    /**
     * Raised when a resource-specific precondition fails. The code is chosen by the handler.
     */
    public static class ValidationFailed extends AwsException {
        public ValidationFailed(String errorCode, String message) {
            super(errorCode, 400, message);
        }
    }

    /**
     * Raised when a referenced resource id does not exist.
     */
    public static class NotFound extends AwsException {
        private final String resourceType;
        private final String resourceId;

        public NotFound(String errorCode, String resourceType, String resourceId) {
            super(errorCode, 400, "The " + resourceType + " ID '" + resourceId + "' does not exist");
            this.resourceType = resourceType;
            this.resourceId = resourceId;
        }

        public String resourceType() {
            return resourceType;
        }

        public String resourceId() {
            return resourceId;
        }
    }

    /**
     * Raised when a delete is blocked by a live reference.
     */
    public static class DependencyViolation extends AwsException {
        private final String resourceId;

        public DependencyViolation(String resourceType, String resourceId) {
            super("DependencyViolation", 400,
                    "The " + resourceType + " '" + resourceId + "' has dependencies and cannot be deleted.");
            this.resourceId = resourceId;
        }

        public String resourceId() {
            return resourceId;
        }
    }

    /**
     * Raised when no handler is registered for the requested action.
     */
    public static class UnsupportedAction extends AwsException {
        public UnsupportedAction(String service, String action) {
            super("InvalidAction", 400,
                    "The action " + action + " is not valid for this web service (" + service + ").");
        }
    }

    /**
     * Raised when a mutating request carries {@code DryRun=true} and would otherwise succeed.
     */
    public static class DryRunOperation extends AwsException {
        public DryRunOperation() {
            super("DryRunOperation", 412, "Request would have succeeded, but DryRun flag is set.");
        }
    }

    /**
     * Invariant violation or id allocation exhaustion.
     */
    public static class Internal extends AwsException {
        public Internal(String message) {
            super("InternalError", 500, message);
        }

        public Internal(String message, Throwable cause) {
            super("InternalError", 500, message, cause);
        }
    }
}
