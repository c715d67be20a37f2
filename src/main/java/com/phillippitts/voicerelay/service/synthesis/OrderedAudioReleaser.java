package com.phillippitts.voicerelay.service.synthesis;

import com.phillippitts.voicerelay.util.Latency;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Reorder buffer between out-of-order synthesis completions and the audio sink.
 *
 * <p>A segment is released only after every lower sequence number was released or skipped.
 * A failed segment is skipped once a higher sequence number has been received, since it cannot
 * be the last one; a failed segment that turns out to be the last of a completed stream stays at
 * the head until {@link #releaseSubstitute(int, byte[])} or {@link #skipRemaining()}.
 *
 * <p>Sink calls happen under the lock, so they are serialized and in order. Once
 * {@link #close() closed}, audio is dropped instead of reaching the sink.
 */
final class OrderedAudioReleaser {

    private static final Logger LOG = LogManager.getLogger(OrderedAudioReleaser.class);

    private final AudioSink sink;
    private final long startNanos;
    private final LongSupplier nanoTime;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Integer, byte[]> ready = new HashMap<>();
    private final Set<Integer> failed = new TreeSet<>();
    private final List<Integer> failedSequences = new ArrayList<>();
    private int nextSequence = 1;
    private int highestReceived;
    private int lastSequence = -1;
    private int released;
    private long firstAudioNanos = -1;
    private volatile boolean closed;

    OrderedAudioReleaser(AudioSink sink, long startNanos, LongSupplier nanoTime) {
        this.sink = sink;
        this.startNanos = startNanos;
        this.nanoTime = nanoTime;
    }

    void received(int sequence) {
        lock.lock();
        try {
            highestReceived = Math.max(highestReceived, sequence);
            drain();
        } finally {
            lock.unlock();
        }
    }

    void completed(int sequence, byte[] audio) {
        lock.lock();
        try {
            ready.put(sequence, audio);
            drain();
        } finally {
            lock.unlock();
        }
    }

    void failed(int sequence) {
        lock.lock();
        try {
            failed.add(sequence);
            failedSequences.add(sequence);
            drain();
        } finally {
            lock.unlock();
        }
    }

    void streamCompleted(int last) {
        lock.lock();
        try {
            lastSequence = last;
            drain();
        } finally {
            lock.unlock();
        }
    }

    /** Stops all further sink calls. A sink call in progress finishes first. */
    void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    /** The failed last segment of a completed stream, once everything before it was released. */
    OptionalInt pendingTerminalFailure() {
        lock.lock();
        try {
            boolean terminal = lastSequence > 0 && nextSequence == lastSequence && failed.contains(nextSequence);
            return terminal ? OptionalInt.of(nextSequence) : OptionalInt.empty();
        } finally {
            lock.unlock();
        }
    }

    /** Releases replacement audio in place of a failed segment. */
    void releaseSubstitute(int sequence, byte[] audio) {
        lock.lock();
        try {
            if (sequence != nextSequence || !failed.remove(sequence)) {
                throw new IllegalStateException("Segment " + sequence + " is not awaiting a substitute");
            }
            emit(sequence, audio);
            nextSequence++;
            drain();
        } finally {
            lock.unlock();
        }
    }

    /** Skips failed segments left at the head. */
    void skipRemaining() {
        lock.lock();
        try {
            while (failed.remove(nextSequence)) {
                nextSequence++;
                drain();
            }
        } finally {
            lock.unlock();
        }
    }

    int released() {
        lock.lock();
        try {
            return released;
        } finally {
            lock.unlock();
        }
    }

    List<Integer> failedSequences() {
        lock.lock();
        try {
            return List.copyOf(failedSequences);
        } finally {
            lock.unlock();
        }
    }

    long firstAudioMillis() {
        lock.lock();
        try {
            return firstAudioNanos < 0 ? -1 : Latency.millisBetween(startNanos, firstAudioNanos);
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        while (true) {
            byte[] audio = ready.remove(nextSequence);
            if (audio != null) {
                emit(nextSequence, audio);
                nextSequence++;
            } else if (failed.contains(nextSequence) && highestReceived > nextSequence) {
                failed.remove(nextSequence);
                LOG.debug("Skipping failed segment {}", nextSequence);
                nextSequence++;
            } else {
                return;
            }
        }
    }

    private void emit(int sequence, byte[] audio) {
        if (closed) {
            LOG.debug("Dropping audio of segment {}, turn was cancelled", sequence);
            return;
        }
        if (firstAudioNanos < 0) {
            firstAudioNanos = nanoTime.getAsLong();
        }
        try {
            sink.accept(sequence, audio);
            released++;
        } catch (RuntimeException e) {
            LOG.warn("Audio sink rejected segment {}: {}", sequence, e.toString());
        }
    }
}
