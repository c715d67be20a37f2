package com.phillippitts.voicerelay.domain;

/**
 * One element of a generation stream.
 *
 * @param type  delta type
 * @param text  content text (CONTENT only)
 * @param usage token usage (END only, may be {@link TokenUsage#NONE})
 * @param error failure cause (ERROR only)
 */
public record TextDelta(Type type, String text, TokenUsage usage, Throwable error) {

    public enum Type { CONTENT, END, ERROR }

    public static TextDelta content(String text) {
        return new TextDelta(Type.CONTENT, text, null, null);
    }

    public static TextDelta end(TokenUsage usage) {
        return new TextDelta(Type.END, null, usage == null ? TokenUsage.NONE : usage, null);
    }

    public static TextDelta end() {
        return end(TokenUsage.NONE);
    }

    public static TextDelta error(Throwable error) {
        return new TextDelta(Type.ERROR, null, null, error);
    }
}
