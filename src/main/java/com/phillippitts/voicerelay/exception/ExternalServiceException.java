package com.phillippitts.voicerelay.exception;

/**
 * Thrown when a call to an external generation or synthesis service fails.
 *
 * <p>The {@link #getTarget() target} names what was called: a model identifier for the
 * generation service, or {@code synthesis:<voice>} for the synthesis service. Subclasses
 * encode the failure kind so the resilience layer can choose between backoff, region
 * fallback and model fallback.
 */
public class ExternalServiceException extends VoiceRelayException {

    private final String target;

    public ExternalServiceException(String message, String target) {
        super(message + " (target: " + target + ")");
        this.target = target;
    }

    public ExternalServiceException(String message, String target, Throwable cause) {
        super(message + " (target: " + target + ")", cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
