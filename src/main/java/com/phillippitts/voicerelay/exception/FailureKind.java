package com.phillippitts.voicerelay.exception;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Stable classification of external-call failures, used to pick a recovery path.
 *
 * <p>Classification walks the cause chain, so a timeout wrapped by a client library still
 * classifies as {@link #TIMEOUT}.
 */
public enum FailureKind {
    RATE_LIMITED,
    SERVICE_UNAVAILABLE,
    TIMEOUT,
    REQUEST_INVALID,
    CIRCUIT_OPEN,
    /** Anything else that may succeed on another attempt. */
    TRANSIENT;

    /**
     * Maps an HTTP status code of a failed call to a failure kind.
     *
     * @param status HTTP status (expected to be non-2xx)
     * @return failure kind for the status
     */
    public static FailureKind fromHttpStatus(int status) {
        return switch (status) {
            case 429 -> RATE_LIMITED;
            case 408, 504 -> TIMEOUT;
            case 400, 404, 413, 422 -> REQUEST_INVALID;
            case 500, 502, 503, 529 -> SERVICE_UNAVAILABLE;
            default -> status >= 500 ? SERVICE_UNAVAILABLE : TRANSIENT;
        };
    }

    /**
     * Classifies a throwable, looking through its cause chain.
     *
     * @param throwable failure to classify (nullable)
     * @return failure kind; {@link #TRANSIENT} when nothing more specific is known
     */
    public static FailureKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            FailureKind kind = classifyKnown(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return throwable instanceof IOException ? SERVICE_UNAVAILABLE : TRANSIENT;
    }

    /** True for kinds that should never be retried. */
    public boolean isTerminal() {
        return this == REQUEST_INVALID;
    }

    private static FailureKind classifyKnown(Throwable t) {
        if (t instanceof RateLimitedException) {
            return RATE_LIMITED;
        }
        if (t instanceof ServiceTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (t instanceof RequestInvalidException) {
            return REQUEST_INVALID;
        }
        if (t instanceof CircuitOpenException) {
            return CIRCUIT_OPEN;
        }
        if (t instanceof ServiceUnavailableException) {
            return SERVICE_UNAVAILABLE;
        }
        return null;
    }
}
