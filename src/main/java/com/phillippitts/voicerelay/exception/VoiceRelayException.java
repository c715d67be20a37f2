package com.phillippitts.voicerelay.exception;

/**
 * Base exception for all voicerelay application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceRelayException extends RuntimeException {

    public VoiceRelayException(String message) {
        super(message);
    }

    public VoiceRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceRelayException(Throwable cause) {
        super(cause);
    }
}
