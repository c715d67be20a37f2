package com.phillippitts.voicerelay.domain;

/** Who spoke a conversation turn. */
public enum SpeakerRole {
    CALLER,
    AGENT
}
