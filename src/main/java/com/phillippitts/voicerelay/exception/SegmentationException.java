package com.phillippitts.voicerelay.exception;

/**
 * Thrown when a generation stream delivers malformed data (content after the end marker,
 * a content delta without text). Aborts synthesis for the current turn.
 */
public class SegmentationException extends VoiceRelayException {

    public SegmentationException(String message) {
        super(message);
    }
}
