package com.phillippitts.voicerelay.domain;

import java.util.Objects;

/**
 * One chat message of a generation request.
 *
 * @param role    {@code user} or {@code assistant}
 * @param content message text
 */
public record GenerationMessage(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public GenerationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GenerationMessage user(String content) {
        return new GenerationMessage(USER, content);
    }

    public static GenerationMessage assistant(String content) {
        return new GenerationMessage(ASSISTANT, content);
    }
}
