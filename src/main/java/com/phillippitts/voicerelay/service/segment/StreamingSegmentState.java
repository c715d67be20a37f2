package com.phillippitts.voicerelay.service.segment;

/**
 * Mutable state of one turn's segmenter: the text buffer, the segment counter and the
 * first-token timestamp.
 *
 * <p>Owned by a single {@link SentenceSegmenter} and touched only by its thread.
 */
final class StreamingSegmentState {

    private final StringBuilder buffer = new StringBuilder();
    private int emittedCount;
    private Long firstTokenNanos;

    void append(String text) {
        buffer.append(text);
    }

    CharSequence buffer() {
        return buffer;
    }

    /** Removes and returns the first {@code length} characters of the buffer. */
    String take(int length) {
        String head = buffer.substring(0, length);
        buffer.delete(0, length);
        return head;
    }

    String drain() {
        String all = buffer.toString();
        buffer.setLength(0);
        return all;
    }

    int nextSequence() {
        return ++emittedCount;
    }

    int emittedCount() {
        return emittedCount;
    }

    /**
     * Records the first-token time once.
     *
     * @return true if this call recorded it
     */
    boolean markFirstToken(long nanos) {
        if (firstTokenNanos != null) {
            return false;
        }
        firstTokenNanos = nanos;
        return true;
    }

    Long firstTokenNanos() {
        return firstTokenNanos;
    }
}
