package com.phillippitts.voicerelay.service.generation;

/**
 * Fixed guidance appended to every agent prompt so answers sound natural when spoken.
 */
public final class VoiceDeliveryGuidelines {

    public static final String TEXT = """
            You are speaking on a live phone call. Your reply will be converted to speech.
            - Keep responses short: one to three sentences.
            - Use natural contractions (I'm, you're, let's) and plain words.
            - Do not use lists, markdown, emoji, URLs or special characters.
            - Spell out numbers and abbreviations the way a person would say them.
            - End with a clear closing question when the caller needs to respond.""";

    private VoiceDeliveryGuidelines() {
    }

    /**
     * Appends the guidelines to an agent prompt.
     *
     * @param agentPrompt agent prompt (nullable or blank for none)
     * @return combined system prompt
     */
    public static String appendTo(String agentPrompt) {
        if (agentPrompt == null || agentPrompt.isBlank()) {
            return TEXT;
        }
        return agentPrompt.strip() + "\n\n" + TEXT;
    }
}
