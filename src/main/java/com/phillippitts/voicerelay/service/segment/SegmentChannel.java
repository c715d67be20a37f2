package com.phillippitts.voicerelay.service.segment;

import com.phillippitts.voicerelay.domain.SegmentEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, ordered hand-off of segment events from one turn's segmenter to its synthesis
 * dispatcher.
 *
 * <p>Single producer, single consumer. The producer blocks while the channel is full. A stream
 * ends either with {@link #complete(int)} or with an ERROR event. {@link #close()} abandons the
 * channel: both sides return promptly and later events are dropped.
 */
public final class SegmentChannel {

    private static final Logger LOG = LogManager.getLogger(SegmentChannel.class);
    private static final SegmentEvent END_OF_STREAM = SegmentEvent.finalRemainder(0, "");
    private static final long OFFER_POLL_MS = 50;

    private final BlockingQueue<SegmentEvent> queue;
    private volatile int lastSequence = -1;
    private volatile boolean closed;

    public SegmentChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Publishes one event, blocking while the channel is full.
     */
    public void publish(SegmentEvent event) throws InterruptedException {
        if (!offer(event)) {
            LOG.debug("Dropping {} event {} on a closed channel", event.type(), event.sequence());
        }
    }

    /**
     * Marks the stream complete.
     *
     * @param lastSequence highest sequence number published, 0 if none
     */
    public void complete(int lastSequence) throws InterruptedException {
        this.lastSequence = lastSequence;
        offer(END_OF_STREAM);
    }

    /**
     * Takes the next event.
     *
     * @return next event, or null once the stream is complete or the channel closed
     */
    public SegmentEvent take() throws InterruptedException {
        if (closed) {
            return null;
        }
        SegmentEvent event = queue.take();
        if (event == END_OF_STREAM) {
            // producer is done, so there is room to put the marker back for repeated takes
            queue.offer(END_OF_STREAM);
            return null;
        }
        return event;
    }

    /** Abandons the channel, waking a blocked producer or consumer. Idempotent. */
    public void close() {
        closed = true;
        queue.clear();
        queue.offer(END_OF_STREAM);
    }

    public boolean isClosed() {
        return closed;
    }

    /** True once {@link #complete(int)} was called. */
    public boolean isCompleted() {
        return lastSequence >= 0;
    }

    /** Highest sequence number of a completed stream, -1 while the stream is open. */
    public int lastSequence() {
        return lastSequence;
    }

    private boolean offer(SegmentEvent event) throws InterruptedException {
        while (!closed) {
            if (queue.offer(event, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }
}
