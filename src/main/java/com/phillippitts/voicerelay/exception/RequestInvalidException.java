package com.phillippitts.voicerelay.exception;

/**
 * The service rejected the request itself (HTTP 400/404/413/422), or the request could not
 * be built. Never retried: it points at a request-building or configuration bug.
 */
public class RequestInvalidException extends ExternalServiceException {

    public RequestInvalidException(String message, String target) {
        super(message, target);
    }

    public RequestInvalidException(String message, String target, Throwable cause) {
        super(message, target, cause);
    }
}
