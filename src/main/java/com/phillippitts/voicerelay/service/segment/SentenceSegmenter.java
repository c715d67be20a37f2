package com.phillippitts.voicerelay.service.segment;

import com.phillippitts.voicerelay.domain.SegmentEvent;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.domain.TokenUsage;
import com.phillippitts.voicerelay.exception.SegmentationException;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import com.phillippitts.voicerelay.util.Latency;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a streamed response into sentences as soon as their boundaries appear.
 *
 * <p>A boundary is {@code .}, {@code !} or {@code ?} followed by whitespace and an uppercase
 * letter, or followed by the end of the stream (trailing whitespace allowed). Each complete
 * sentence is published as a SENTENCE event right away; the remainder, including its leading
 * whitespace, stays buffered. At END any non-blank remainder is published as one FINAL event.
 * SENTENCE and FINAL share one sequence counter starting at 1.
 *
 * <p>An ERROR delta or malformed data (null content) publishes a single ERROR event and stops
 * the segmenter. Deltas after the segmenter stopped are ignored.
 *
 * <p>One instance per turn. Not thread-safe: the stream consumer thread is the only writer.
 */
public final class SentenceSegmenter {

    private static final Logger LOG = LogManager.getLogger(SentenceSegmenter.class);

    /** Punctuation run, whitespace, then an uppercase letter. Group 1 ends the sentence. */
    private static final Pattern MID_STREAM_BOUNDARY = Pattern.compile("([.!?]+)\\s+(?=\\p{Lu})");

    /** Punctuation run at the very end of the text, trailing whitespace allowed. */
    private static final Pattern END_OF_STREAM_BOUNDARY = Pattern.compile("[.!?]+\\s*$");

    private final SegmentChannel channel;
    private final long requestStartNanos;
    private final LongSupplier nanoTime;
    private final StreamingSegmentState state = new StreamingSegmentState();
    private boolean stopped;
    private TokenUsage usage = TokenUsage.NONE;
    private final StringBuilder publishedText = new StringBuilder();

    public SentenceSegmenter(SegmentChannel channel, long requestStartNanos) {
        this(channel, requestStartNanos, System::nanoTime);
    }

    SentenceSegmenter(SegmentChannel channel, long requestStartNanos, LongSupplier nanoTime) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.requestStartNanos = requestStartNanos;
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    /**
     * Reads the stream until its terminal delta, publishing segments as they complete.
     *
     * @param stream open generation stream; closed when this method returns
     * @throws InterruptedException if the thread is interrupted while the channel is full
     */
    public void consume(GenerationStream stream) throws InterruptedException {
        try (stream) {
            while (accept(stream.next())) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Segmenter interrupted");
                }
            }
        }
    }

    /**
     * Handles one delta.
     *
     * @param delta next delta from the stream
     * @return true while more deltas are expected
     * @throws InterruptedException if interrupted while the channel is full
     */
    public boolean accept(TextDelta delta) throws InterruptedException {
        if (stopped) {
            LOG.warn("Ignoring {} delta received after the stream ended", delta == null ? "null" : delta.type());
            return false;
        }
        if (delta == null) {
            fail(new SegmentationException("Generation stream produced a null delta"));
            return false;
        }
        switch (delta.type()) {
            case CONTENT -> {
                if (delta.text() == null) {
                    fail(new SegmentationException("Content delta without text"));
                    return false;
                }
                if (state.markFirstToken(nanoTime.getAsLong())) {
                    LOG.debug("First token after {} ms", firstTokenLatencyMillis().orElse(-1));
                }
                state.append(delta.text());
                emitCompleteSentences();
                return true;
            }
            case END -> {
                if (delta.usage() != null) {
                    usage = delta.usage();
                }
                finish();
                return false;
            }
            case ERROR -> {
                Throwable error = delta.error() != null ? delta.error()
                        : new SegmentationException("Error delta without cause");
                fail(error);
                return false;
            }
            default -> throw new IllegalStateException("Unknown delta type: " + delta.type());
        }
    }

    /** Request start to first CONTENT delta, empty until one arrived. */
    public OptionalLong firstTokenLatencyMillis() {
        Long first = state.firstTokenNanos();
        return first == null ? OptionalLong.empty() : OptionalLong.of(Latency.millisBetween(requestStartNanos, first));
    }

    /** Segments published so far. */
    public int emittedCount() {
        return state.emittedCount();
    }

    /** Token usage reported with END, {@link TokenUsage#NONE} until then. */
    public TokenUsage usage() {
        return usage;
    }

    /** Text of every published segment, concatenated in sequence order. */
    public String publishedText() {
        return publishedText.toString();
    }

    /** True once END or ERROR was handled. */
    public boolean isStopped() {
        return stopped;
    }

    private void emitCompleteSentences() throws InterruptedException {
        Matcher matcher = MID_STREAM_BOUNDARY.matcher(state.buffer());
        int lastSentenceEnd = -1;
        int consumed = 0;
        while (matcher.find()) {
            lastSentenceEnd = matcher.end(1);
            String sentence = state.buffer().subSequence(consumed, lastSentenceEnd).toString();
            publish(SegmentEvent.sentence(state.nextSequence(), sentence));
            consumed = lastSentenceEnd;
        }
        if (lastSentenceEnd > 0) {
            // the remainder keeps the whitespace that followed the punctuation
            state.take(lastSentenceEnd);
        }
    }

    private void finish() throws InterruptedException {
        stopped = true;
        String remainder = state.drain();
        if (!remainder.isBlank()) {
            String text = remainder.stripTrailing();
            if (END_OF_STREAM_BOUNDARY.matcher(remainder).find()) {
                publish(SegmentEvent.sentence(state.nextSequence(), text));
            } else {
                publish(SegmentEvent.finalRemainder(state.nextSequence(), text));
            }
        }
        channel.complete(state.emittedCount());
        LOG.debug("Segmentation complete: segments={}", state.emittedCount());
    }

    private void publish(SegmentEvent event) throws InterruptedException {
        publishedText.append(event.text());
        channel.publish(event);
    }

    private void fail(Throwable error) throws InterruptedException {
        stopped = true;
        state.drain();
        LOG.warn("Generation stream failed after {} segments: {}", state.emittedCount(), error.toString());
        channel.publish(SegmentEvent.error(error));
    }
}
