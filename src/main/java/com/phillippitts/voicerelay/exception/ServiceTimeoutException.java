package com.phillippitts.voicerelay.exception;

/**
 * The call did not answer within its deadline. The model/region pairing is treated as
 * unsuitable for the active latency budget, so callers move to a faster model rather
 * than retrying the same one.
 */
public class ServiceTimeoutException extends ExternalServiceException {

    public ServiceTimeoutException(String message, String target) {
        super(message, target);
    }

    public ServiceTimeoutException(String message, String target, Throwable cause) {
        super(message, target, cause);
    }
}
