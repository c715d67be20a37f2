/**
 * Immutable value types shared across the voice-turn pipeline.
 *
 * <p>Everything here is a record or an enum. Records validate their invariants in compact
 * constructors and copy incoming collections, so instances are safe to hand between the
 * turn, stream-consumer and synthesis threads without further synchronization.
 */
package com.phillippitts.voicerelay.domain;
