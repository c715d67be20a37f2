package com.phillippitts.voicerelay.domain;

/** Coarse capability band of a generation model. */
public enum ModelTier {
    FAST,
    MID,
    HIGH
}
