package com.phillippitts.voicerelay.util;

import java.util.Arrays;
import java.util.List;

/**
 * Utility for splitting caller utterances into words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on runs of whitespace</li>
 *   <li>Leading and trailing whitespace is ignored</li>
 *   <li>Punctuation stays attached to its word ("appointment?" is one word)</li>
 * </ul>
 */
public final class TokenizerUtil {

    private static final String WHITESPACE = "\\s+";

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Splits text into whitespace-separated words.
     *
     * @param text input text (may be null or blank)
     * @return immutable list of words (empty if none)
     */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return List.copyOf(Arrays.asList(text.strip().split(WHITESPACE)));
    }

    /**
     * Counts whitespace-separated words.
     *
     * @param text input text (may be null or blank)
     * @return number of words, 0 for null or blank input
     */
    public static int wordCount(String text) {
        return words(text).size();
    }
}
