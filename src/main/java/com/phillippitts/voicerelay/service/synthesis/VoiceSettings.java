package com.phillippitts.voicerelay.service.synthesis;

import com.phillippitts.voicerelay.config.properties.SynthesisProperties;

import java.util.Objects;

/**
 * Voice and audio format requested from the synthesis service.
 *
 * @param voice      voice model name
 * @param encoding   audio encoding (e.g. {@code mulaw}, {@code linear16})
 * @param sampleRate sample rate in Hz
 */
public record VoiceSettings(String voice, String encoding, int sampleRate) {

    public VoiceSettings {
        Objects.requireNonNull(voice, "voice must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    public static VoiceSettings from(SynthesisProperties props) {
        return new VoiceSettings(props.getVoice(), props.getEncoding(), props.getSampleRate());
    }

    /** Circuit breaker target for this voice. */
    public String breakerTarget() {
        return "synthesis:" + voice;
    }
}
