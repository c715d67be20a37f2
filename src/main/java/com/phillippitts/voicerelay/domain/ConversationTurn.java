package com.phillippitts.voicerelay.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One finalized utterance in a call.
 *
 * @param role      who spoke
 * @param text      what was said (may be empty, never null)
 * @param timestamp when the turn was finalized
 */
public record ConversationTurn(SpeakerRole role, String text, Instant timestamp) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static ConversationTurn caller(String text) {
        return new ConversationTurn(SpeakerRole.CALLER, text, Instant.now());
    }

    public static ConversationTurn agent(String text) {
        return new ConversationTurn(SpeakerRole.AGENT, text, Instant.now());
    }
}
