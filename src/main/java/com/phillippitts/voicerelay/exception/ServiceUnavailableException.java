package com.phillippitts.voicerelay.exception;

/**
 * The service (or the region serving it) is overloaded or down: HTTP 5xx, a refused
 * connection, or an I/O failure before any response arrived.
 */
public class ServiceUnavailableException extends ExternalServiceException {

    public ServiceUnavailableException(String message, String target) {
        super(message, target);
    }

    public ServiceUnavailableException(String message, String target, Throwable cause) {
        super(message, target, cause);
    }
}
