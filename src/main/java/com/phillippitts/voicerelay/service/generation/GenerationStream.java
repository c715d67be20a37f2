package com.phillippitts.voicerelay.service.generation;

import com.phillippitts.voicerelay.domain.TextDelta;

/**
 * Pull-based stream of generation deltas for one request.
 *
 * <p>A stream yields any number of CONTENT deltas followed by exactly one END or ERROR delta.
 * Transport failures after the stream was opened surface as an ERROR delta, never as an
 * exception from {@link #next()}.
 *
 * <p>Streams are read by a single consumer thread. {@link #close()} may be called from any
 * thread to abort a blocked read, for example on hangup.
 */
public interface GenerationStream extends AutoCloseable {

    /**
     * Blocks until the next delta is available.
     *
     * @return next delta
     * @throws IllegalStateException if called after the terminal delta was returned
     */
    TextDelta next();

    /** Releases the underlying connection. Idempotent. */
    @Override
    void close();
}
