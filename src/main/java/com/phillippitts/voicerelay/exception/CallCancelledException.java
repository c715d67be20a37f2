package com.phillippitts.voicerelay.exception;

/**
 * Thrown when work for a call stops because the caller hung up.
 */
public class CallCancelledException extends VoiceRelayException {

    public CallCancelledException(String callId) {
        super("Call cancelled: " + callId);
    }

    public CallCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
