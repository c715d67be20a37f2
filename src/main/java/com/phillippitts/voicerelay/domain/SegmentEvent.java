package com.phillippitts.voicerelay.domain;

/**
 * Output of the sentence segmenter: a unit of synthesis dispatch, or the terminal error.
 *
 * @param type     event type
 * @param sequence playback order, starting at 1; 0 for ERROR
 * @param text     sentence or remainder text (null for ERROR)
 * @param error    failure cause (ERROR only)
 */
public record SegmentEvent(Type type, int sequence, String text, Throwable error) {

    public enum Type {
        /** A complete sentence, emitted as soon as its boundary is seen. */
        SENTENCE,
        /** Text left in the buffer at stream end. */
        FINAL,
        /** The stream failed; nothing follows. */
        ERROR
    }

    public static SegmentEvent sentence(int sequence, String text) {
        return new SegmentEvent(Type.SENTENCE, sequence, text, null);
    }

    public static SegmentEvent finalRemainder(int sequence, String text) {
        return new SegmentEvent(Type.FINAL, sequence, text, null);
    }

    public static SegmentEvent error(Throwable error) {
        return new SegmentEvent(Type.ERROR, 0, null, error);
    }

    /** True for events that carry text to synthesize. */
    public boolean isSpeakable() {
        return type != Type.ERROR;
    }
}
