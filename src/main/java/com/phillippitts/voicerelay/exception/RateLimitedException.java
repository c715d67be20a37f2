package com.phillippitts.voicerelay.exception;

/** The service refused the call because the caller exceeded its rate or token quota (HTTP 429). */
public class RateLimitedException extends ExternalServiceException {

    public RateLimitedException(String message, String target) {
        super(message, target);
    }

    public RateLimitedException(String message, String target, Throwable cause) {
        super(message, target, cause);
    }
}
