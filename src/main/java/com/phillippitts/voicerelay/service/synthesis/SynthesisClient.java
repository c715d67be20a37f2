package com.phillippitts.voicerelay.service.synthesis;

import com.phillippitts.voicerelay.exception.ExternalServiceException;

/**
 * Text-to-speech access.
 */
public interface SynthesisClient {

    /**
     * Synthesizes one text segment.
     *
     * @param text  text to speak (non-blank)
     * @param voice voice and audio format
     * @return raw audio bytes in the requested encoding
     * @throws ExternalServiceException on failure; the subclass encodes the failure kind
     */
    byte[] synthesize(String text, VoiceSettings voice);
}
