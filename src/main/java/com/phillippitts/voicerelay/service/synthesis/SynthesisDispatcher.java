package com.phillippitts.voicerelay.service.synthesis;

import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.domain.DispatchReport;
import com.phillippitts.voicerelay.domain.SegmentEvent;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.service.resilience.ResilientSynthesis;
import com.phillippitts.voicerelay.service.segment.SegmentChannel;
import com.phillippitts.voicerelay.service.synthesis.event.SegmentSynthesisFailedEvent;
import com.phillippitts.voicerelay.util.CancellationToken;
import com.phillippitts.voicerelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Turns a turn's segment events into ordered audio.
 *
 * <p>Each SENTENCE or FINAL event becomes one synthesis call on {@code synthesisExecutor}, with
 * at most {@code voicerelay.synthesis.max-concurrency} calls outstanding per turn; further events
 * wait for a permit. Audio reaches the sink in sequence order through a reorder buffer.
 *
 * <p>Failures:
 * <ul>
 *   <li>A failed segment that is not the last is reported and skipped</li>
 *   <li>A failed last segment of a completed stream is replaced by the fallback phrase</li>
 *   <li>An ERROR event stops dispatch; segments already submitted still play</li>
 * </ul>
 *
 * <p>Cancelling the turn's token stops dispatch, interrupts synthesis calls in flight and closes
 * the reorder buffer, so no audio reaches the sink afterwards.
 */
@Service
public class SynthesisDispatcher {

    private static final Logger LOG = LogManager.getLogger(SynthesisDispatcher.class);
    private static final long PERMIT_POLL_MS = 50;

    private final ResilientSynthesis synthesis;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final VoiceSettings voice;
    private final int maxConcurrency;
    private final String fallbackPhrase;
    private final LongSupplier nanoTime;

    @Autowired
    public SynthesisDispatcher(ResilientSynthesis synthesis,
                               @Qualifier("synthesisExecutor") Executor executor,
                               SynthesisProperties props,
                               ApplicationEventPublisher publisher,
                               Clock clock) {
        this(synthesis, executor, props, publisher, clock, System::nanoTime);
    }

    public SynthesisDispatcher(ResilientSynthesis synthesis,
                               Executor executor,
                               SynthesisProperties props,
                               ApplicationEventPublisher publisher,
                               Clock clock,
                               LongSupplier nanoTime) {
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.voice = VoiceSettings.from(props);
        this.maxConcurrency = props.getMaxConcurrency();
        this.fallbackPhrase = props.getFallbackPhrase();
    }

    /**
     * Dispatches segments until the channel completes or delivers an ERROR, then waits for the
     * outstanding synthesis calls.
     *
     * @param channel segment events of one turn
     * @param sink    receives audio in sequence order
     * @param token   turn cancellation
     * @return what was dispatched and released
     */
    public DispatchReport dispatch(SegmentChannel channel, AudioSink sink, CancellationToken token) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(token, "token");

        OrderedAudioReleaser releaser = new OrderedAudioReleaser(sink, nanoTime.getAsLong(), nanoTime);
        Semaphore permits = new Semaphore(maxConcurrency);
        List<Future<Void>> futures = new CopyOnWriteArrayList<>();
        token.onCancel(releaser::close);
        token.onCancel(() -> futures.forEach(f -> f.cancel(true)));
        token.onCancel(channel::close);

        int dispatched = 0;
        Throwable streamError = null;
        try {
            while (true) {
                token.throwIfCancelled();
                SegmentEvent event = channel.take();
                token.throwIfCancelled();
                if (event == null) {
                    releaser.streamCompleted(channel.lastSequence());
                    break;
                }
                if (event.type() == SegmentEvent.Type.ERROR) {
                    streamError = event.error();
                    break;
                }
                releaser.received(event.sequence());
                acquire(permits, token);
                dispatched++;
                FutureTask<Void> task = new FutureTask<>(
                        () -> synthesizeSegment(event, releaser, permits, token), null);
                futures.add(task);
                executor.execute(task);
            }
            awaitAll(futures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(dispatched, releaser, futures, streamError);
        } catch (CallCancelledException | CancellationException e) {
            return cancelled(dispatched, releaser, futures, streamError);
        }

        boolean substituted = streamError == null && substituteTerminal(releaser, token);
        releaser.skipRemaining();
        DispatchReport report = new DispatchReport(dispatched, releaser.released(), releaser.failedSequences(),
                substituted, releaser.firstAudioMillis(), streamError, false);
        LOG.debug("Dispatch finished: dispatched={}, released={}, failed={}",
                report.dispatched(), report.released(), report.failedSequences());
        return report;
    }

    private void synthesizeSegment(SegmentEvent event, OrderedAudioReleaser releaser,
                                   Semaphore permits, CancellationToken token) {
        try {
            byte[] audio = synthesis.synthesize(event.text(), voice, token);
            releaser.completed(event.sequence(), audio);
        } catch (CallCancelledException e) {
            LOG.debug("Synthesis of segment {} cancelled", event.sequence());
        } catch (RuntimeException e) {
            FailureKind kind = FailureKind.classify(e);
            LOG.warn("Synthesis failed for segment {} '{}' ({}): {}", event.sequence(),
                    LogSanitizer.preview(event.text()), kind, e.getMessage());
            releaser.failed(event.sequence());
            publisher.publishEvent(new SegmentSynthesisFailedEvent(token.callId(), event.sequence(), kind,
                    e.getMessage(), clock.instant()));
        } finally {
            permits.release();
        }
    }

    private boolean substituteTerminal(OrderedAudioReleaser releaser, CancellationToken token) {
        OptionalInt terminal = releaser.pendingTerminalFailure();
        if (terminal.isEmpty()) {
            return false;
        }
        try {
            byte[] audio = synthesis.synthesize(fallbackPhrase, voice, token);
            releaser.releaseSubstitute(terminal.getAsInt(), audio);
            LOG.info("Replaced failed final segment {} with the fallback phrase", terminal.getAsInt());
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Fallback phrase synthesis failed: {}", e.toString());
            return false;
        }
    }

    private static void acquire(Semaphore permits, CancellationToken token) throws InterruptedException {
        while (!permits.tryAcquire(PERMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
            token.throwIfCancelled();
        }
    }

    private static void awaitAll(List<Future<Void>> futures) throws InterruptedException {
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // segment tasks handle their own failures
                throw new IllegalStateException("Synthesis task failed unexpectedly", e.getCause());
            }
        }
    }

    private DispatchReport cancelled(int dispatched, OrderedAudioReleaser releaser,
                                     List<Future<Void>> futures, Throwable streamError) {
        releaser.close();
        futures.forEach(f -> f.cancel(true));
        LOG.info("Dispatch cancelled after {} segments", dispatched);
        return new DispatchReport(dispatched, releaser.released(), releaser.failedSequences(),
                false, releaser.firstAudioMillis(), streamError, true);
    }
}
