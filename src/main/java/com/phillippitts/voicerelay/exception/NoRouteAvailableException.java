package com.phillippitts.voicerelay.exception;

import java.util.List;

/**
 * Thrown when every model in the degradation chain failed, was skipped, or the retry budget
 * ran out before any generation stream could be opened.
 */
public class NoRouteAvailableException extends VoiceRelayException {

    private final List<String> attemptedTargets;

    public NoRouteAvailableException(String message, List<String> attemptedTargets, Throwable lastFailure) {
        super(message + " (attempted: " + attemptedTargets + ")", lastFailure);
        this.attemptedTargets = List.copyOf(attemptedTargets);
    }

    public List<String> getAttemptedTargets() {
        return attemptedTargets;
    }
}
