package com.phillippitts.voicerelay.domain;

/** How a turn ended from the caller's point of view. */
public enum TurnOutcome {
    /** The routed model answered. */
    COMPLETED,
    /** A fallback model or region answered. */
    DEGRADED,
    /** No usable answer; a static apology phrase was played instead. */
    APOLOGIZED,
    /** Nothing could be played. */
    FAILED,
    /** The caller hung up before the turn finished. */
    CANCELLED
}
