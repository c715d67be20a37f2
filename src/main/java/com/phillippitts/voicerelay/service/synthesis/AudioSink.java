package com.phillippitts.voicerelay.service.synthesis;

/**
 * Receives a turn's audio in playback order. Supplied per turn by the telephony layer.
 *
 * <p>Calls are serialized: the dispatcher never invokes the sink concurrently, and sequence
 * numbers arrive strictly increasing.
 */
@FunctionalInterface
public interface AudioSink {

    /**
     * @param sequence segment sequence number (for a substituted phrase, the sequence it replaces)
     * @param audio    audio bytes
     */
    void accept(int sequence, byte[] audio);
}
