package com.phillippitts.voicerelay.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalServiceException} subclasses with contextual details.
 *
 * <p>HTTP adapters use it so every failure carries the same diagnostics in the same format.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Status-driven failure
 * throw ExternalServiceExceptionBuilder.create("Generation request rejected")
 *         .target("claude-sonnet-4")
 *         .httpStatus(429)
 *         .durationMs(312)
 *         .metadata("region", "us-east-1")
 *         .build();
 *
 * // Transport failure with an explicit kind
 * throw ExternalServiceExceptionBuilder.create("Synthesis call failed")
 *         .target("synthesis:aura-asteria-en")
 *         .cause(ioException)
 *         .build(FailureKind.SERVICE_UNAVAILABLE);
 * </pre>
 */
public final class ExternalServiceExceptionBuilder {

    private final String message;
    private String target;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ExternalServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalServiceExceptionBuilder(message);
    }

    public ExternalServiceExceptionBuilder target(String target) {
        this.target = target;
        return this;
    }

    public ExternalServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalServiceExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public ExternalServiceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ExternalServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception, deriving its kind from the HTTP status (or the cause when no
     * status was set).
     *
     * @return constructed exception
     */
    public ExternalServiceException build() {
        FailureKind kind = httpStatus != null ? FailureKind.fromHttpStatus(httpStatus) : FailureKind.classify(cause);
        return build(kind);
    }

    /**
     * Builds the exception subclass for the given kind.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...) (target: {target})
     * </pre>
     *
     * @param kind failure kind selecting the subclass
     * @return constructed exception
     */
    public ExternalServiceException build(FailureKind kind) {
        String detailed = buildDetailedMessage();
        String t = target != null ? target : "unknown";
        return switch (kind) {
            case RATE_LIMITED -> new RateLimitedException(detailed, t, cause);
            case TIMEOUT -> new ServiceTimeoutException(detailed, t, cause);
            case REQUEST_INVALID -> new RequestInvalidException(detailed, t, cause);
            case CIRCUIT_OPEN -> new CircuitOpenException(t);
            case SERVICE_UNAVAILABLE -> new ServiceUnavailableException(detailed, t, cause);
            case TRANSIENT -> new ExternalServiceException(detailed, t, cause);
        };
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (httpStatus != null) {
            sb.append("status=").append(httpStatus);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
