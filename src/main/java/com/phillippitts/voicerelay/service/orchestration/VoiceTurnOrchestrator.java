package com.phillippitts.voicerelay.service.orchestration;

import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.domain.ComplexityScore;
import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.domain.ConversationTurn;
import com.phillippitts.voicerelay.domain.DispatchReport;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.domain.TurnOptions;
import com.phillippitts.voicerelay.domain.TurnOutcome;
import com.phillippitts.voicerelay.domain.TurnResult;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.ExternalServiceException;
import com.phillippitts.voicerelay.exception.SegmentationException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import com.phillippitts.voicerelay.service.metrics.TelemetryPublisher;
import com.phillippitts.voicerelay.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.voicerelay.service.orchestration.event.TurnFailedEvent;
import com.phillippitts.voicerelay.service.resilience.ResilientStream;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.service.segment.SegmentChannel;
import com.phillippitts.voicerelay.service.segment.SentenceSegmenter;
import com.phillippitts.voicerelay.service.synthesis.AudioSink;
import com.phillippitts.voicerelay.service.synthesis.VoiceSettings;
import com.phillippitts.voicerelay.util.CancellationToken;
import com.phillippitts.voicerelay.util.Latency;
import com.phillippitts.voicerelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongSupplier;

/**
 * Runs voice turns end to end: score, route, open the generation stream, segment it and play the
 * synthesized sentences in order.
 *
 * <p><b>Threading:</b> turns of one call are chained and run one at a time on
 * {@code turnExecutor}; turns of different calls run concurrently. Inside a turn the stream
 * consumer runs on {@code streamExecutor} while the turn thread dispatches synthesis, connected
 * by a bounded {@link SegmentChannel}.
 *
 * <p><b>Outcomes:</b> every turn future completes with a {@link TurnResult}:
 * <ul>
 *   <li>COMPLETED, or DEGRADED when a fallback model or region answered</li>
 *   <li>APOLOGIZED when no usable answer was played and the apology phrase was</li>
 *   <li>FAILED when not even the apology could be played; a {@link TurnFailedEvent} is published</li>
 *   <li>CANCELLED when the caller hung up</li>
 * </ul>
 *
 * <p><b>Configuration:</b> not annotated as {@code @Component}; see
 * {@link com.phillippitts.voicerelay.config.orchestration.OrchestrationConfig} for bean wiring.
 */
public class VoiceTurnOrchestrator {

    private static final Logger LOG = LogManager.getLogger(VoiceTurnOrchestrator.class);

    static final String MDC_CALL_ID = "callId";
    static final String MDC_TURN = "turn";

    private final TurnPipeline pipeline;
    private final CallSessionRegistry sessions;
    private final Executor turnExecutor;
    private final Executor streamExecutor;
    private final ModelCatalog catalog;
    private final ApplicationEventPublisher publisher;
    private final TelemetryPublisher telemetry;
    private final Clock clock;
    private final LongSupplier nanoTime;
    private final VoiceSettings voice;
    private final int channelCapacity;
    private final String apologyPhrase;

    // CHECKSTYLE.OFF: ParameterNumber - dependencies are grouped in TurnPipeline where they belong together
    public VoiceTurnOrchestrator(TurnPipeline pipeline,
                                 CallSessionRegistry sessions,
                                 Executor turnExecutor,
                                 Executor streamExecutor,
                                 SynthesisProperties synthesisProps,
                                 ModelCatalog catalog,
                                 ApplicationEventPublisher publisher,
                                 TelemetryPublisher telemetry,
                                 Clock clock,
                                 LongSupplier nanoTime) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.turnExecutor = Objects.requireNonNull(turnExecutor, "turnExecutor");
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.telemetry = telemetry != null ? telemetry : TelemetryPublisher.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.voice = VoiceSettings.from(synthesisProps);
        this.channelCapacity = synthesisProps.getChannelCapacity();
        this.apologyPhrase = synthesisProps.getApologyPhrase();
    }
    // CHECKSTYLE.ON: ParameterNumber

    /**
     * Submits a finalized caller utterance of a live call.
     *
     * @param callId    call identifier; the call must have been started
     * @param utterance transcribed caller text
     * @param options   latency budget, cost preference, tools and sampling overrides
     * @param sink      receives the reply audio in order
     * @return future completing with the turn result once the turn finished; never exceptional
     * @throws IllegalStateException if the call is not live
     */
    public CompletableFuture<TurnResult> submitTurn(String callId, String utterance,
                                                    TurnOptions options, AudioSink sink) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(sink, "sink");
        CallSession session = sessions.find(callId)
                .orElseThrow(() -> new IllegalStateException("Call is not live: " + callId));
        return session.enqueue(turnNumber -> CompletableFuture.supplyAsync(
                () -> runTurn(session, turnNumber, utterance, options, sink), turnExecutor));
    }

    TurnResult runTurn(CallSession session, int turnNumber, String utterance, TurnOptions options, AudioSink sink) {
        ThreadContext.put(MDC_CALL_ID, session.callId());
        ThreadContext.put(MDC_TURN, String.valueOf(turnNumber));
        TurnRun run = new TurnRun(session, turnNumber, new CancellationToken(session.callId()), sink,
                nanoTime.getAsLong());
        TurnResult result;
        try {
            if (!session.beginTurn(run.token)) {
                result = cancelled(run, null, "");
            } else {
                result = execute(run, utterance == null ? "" : utterance, options);
            }
        } catch (CallCancelledException e) {
            result = cancelled(run, run.served, "");
        } catch (RuntimeException e) {
            LOG.error("Turn {} failed unexpectedly", turnNumber, e);
            result = result(run, TurnOutcome.FAILED, run.served, "", 0, List.of(), -1, -1, e);
        } finally {
            session.endTurn(run.token);
        }
        try {
            finish(result);
        } finally {
            ThreadContext.remove(MDC_CALL_ID);
            ThreadContext.remove(MDC_TURN);
        }
        return result;
    }

    private TurnResult execute(TurnRun run, String utterance, TurnOptions options) {
        ConversationContext context = run.session.context();
        if (options.needsTools()) {
            context = context.withToolsAnticipated(true);
        }
        ComplexityScore score = pipeline.scorer().score(utterance, context);
        String region = context.regionHint();
        RoutingDecision decision = pipeline.selector().select(score, options.latencyBudgetMs(),
                options.costSensitive(), options.needsTools(), region);
        telemetry.recordRouting(decision);
        LOG.info("Turn routed: rule={}, model={}, region={}, score={}, reasoningBudget={}, utterance='{}'",
                decision.rule(), decision.modelId(), decision.region(), score.value(),
                decision.reasoningBudget(), LogSanitizer.preview(utterance));

        ConversationContext requestContext = context;
        long requestStartNanos = nanoTime.getAsLong();
        ResilientStream opened;
        try {
            opened = pipeline.invoker().open(decision, region,
                    d -> pipeline.requestBuilder().build(utterance, requestContext, d, options), run.token);
        } catch (CallCancelledException e) {
            return cancelled(run, null, "");
        } catch (RuntimeException e) {
            LOG.warn("No generation stream for the turn: {}", e.getMessage());
            return apologize(run, utterance, "", 1, 0, List.of(), -1, -1, e);
        }
        run.served = opened.served();
        return stream(run, utterance, opened, requestStartNanos);
    }

    private TurnResult stream(TurnRun run, String utterance, ResilientStream opened, long requestStartNanos) {
        SegmentChannel channel = new SegmentChannel(channelCapacity);
        run.token.onCancel(channel::close);
        SentenceSegmenter segmenter = new SentenceSegmenter(channel, requestStartNanos);

        CompletableFuture<Void> consumer;
        try {
            consumer = CompletableFuture.runAsync(() -> consume(segmenter, opened.stream(), channel), streamExecutor);
        } catch (RejectedExecutionException e) {
            opened.stream().close();
            LOG.error("Stream executor saturated, dropping the generation stream");
            return apologize(run, utterance, "", 1, 0, List.of(), -1, -1,
                    new ServiceUnavailableException("Stream executor saturated", opened.served().modelId()));
        }

        long dispatchOffsetMillis = Latency.millisBetween(run.startNanos, nanoTime.getAsLong());
        DispatchReport report = pipeline.dispatcher().dispatch(channel, run.sink, run.token);
        awaitConsumer(consumer);

        catalog.find(opened.served().modelId())
                .ifPresent(profile -> telemetry.recordGeneration(profile, segmenter.usage()));
        long firstTokenMillis = segmenter.firstTokenLatencyMillis().orElse(-1);
        long firstAudioMillis = report.firstAudioMillis() < 0 ? -1 : dispatchOffsetMillis + report.firstAudioMillis();
        String spoken = segmenter.publishedText().strip();

        if (report.cancelled() || run.token.isCancelled()) {
            return cancelled(run, opened.served(), spoken);
        }
        if (report.hasStreamError() || report.released() == 0) {
            Throwable cause = report.hasStreamError() ? report.streamError() : silentTurnCause(report, opened);
            return apologize(run, utterance, spoken, report.dispatched() + 1, report.released(),
                    report.failedSequences(), firstTokenMillis, firstAudioMillis, cause);
        }

        run.session.append(ConversationTurn.caller(utterance), ConversationTurn.agent(spoken));
        TurnOutcome outcome = opened.degraded() ? TurnOutcome.DEGRADED : TurnOutcome.COMPLETED;
        return result(run, outcome, opened.served(), spoken, report.released(), report.failedSequences(),
                firstTokenMillis, firstAudioMillis, null);
    }

    private void consume(SentenceSegmenter segmenter, GenerationStream stream, SegmentChannel channel) {
        try {
            segmenter.consume(stream);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Stream consumer interrupted");
            channel.close();
        } catch (RuntimeException e) {
            LOG.warn("Stream consumer failed: {}", e.toString());
            try {
                segmenter.accept(TextDelta.error(e));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                channel.close();
            }
        }
    }

    private static void awaitConsumer(CompletableFuture<Void> consumer) {
        try {
            consumer.join();
        } catch (CompletionException e) {
            LOG.warn("Stream consumer ended abnormally: {}", e.getCause() == null ? e.toString() : e.getCause().toString());
        }
    }

    private Throwable silentTurnCause(DispatchReport report, ResilientStream opened) {
        if (report.dispatched() == 0) {
            return new SegmentationException("Generation produced no speakable text from " + opened.served().modelId());
        }
        return new ExternalServiceException("Synthesis failed for every segment", voice.breakerTarget());
    }

    // CHECKSTYLE.OFF: ParameterNumber
    private TurnResult apologize(TurnRun run, String utterance, String spoken, int sequence, int released,
                                 List<Integer> failedSegments, long firstTokenMillis, long firstAudioMillis,
                                 Throwable cause) {
        long apologyStart = nanoTime.getAsLong();
        try {
            byte[] audio = pipeline.synthesis().synthesize(apologyPhrase, voice, run.token);
            run.sink.accept(sequence, audio);
        } catch (CallCancelledException e) {
            return cancelled(run, run.served, spoken);
        } catch (RuntimeException e) {
            LOG.error("Apology could not be played after '{}': {}", cause.getMessage(), e.toString());
            cause.addSuppressed(e);
            run.session.append(ConversationTurn.caller(utterance));
            return result(run, TurnOutcome.FAILED, run.served, spoken, released, failedSegments,
                    firstTokenMillis, firstAudioMillis, cause);
        }
        String heard = released > 0 ? spoken : "";
        String agentText = heard.isEmpty() ? apologyPhrase : heard + " " + apologyPhrase;
        run.session.append(ConversationTurn.caller(utterance), ConversationTurn.agent(agentText));
        long firstAudio = firstAudioMillis >= 0 ? firstAudioMillis
                : Latency.millisBetween(run.startNanos, apologyStart);
        return result(run, TurnOutcome.APOLOGIZED, run.served, agentText, released + 1, failedSegments,
                firstTokenMillis, firstAudio, cause);
    }

    private TurnResult cancelled(TurnRun run, RoutingDecision served, String spoken) {
        return result(run, TurnOutcome.CANCELLED, served, spoken, 0, List.of(), -1, -1,
                new CallCancelledException(run.session.callId()));
    }

    private TurnResult result(TurnRun run, TurnOutcome outcome, RoutingDecision served, String spoken,
                              int released, List<Integer> failedSegments, long firstTokenMillis,
                              long firstAudioMillis, Throwable failure) {
        return new TurnResult(run.session.callId(), run.turnNumber, outcome,
                served != null ? served.modelId() : null,
                served != null ? served.region() : null,
                spoken, released, failedSegments, firstTokenMillis, firstAudioMillis,
                Latency.millisBetween(run.startNanos, nanoTime.getAsLong()), failure);
    }
    // CHECKSTYLE.ON: ParameterNumber

    private void finish(TurnResult result) {
        LOG.info("Turn finished: outcome={}, model={}, region={}, released={}, firstAudioMs={}, durationMs={}",
                result.outcome(), result.modelId(), result.region(), result.segmentsReleased(),
                result.firstAudioMillis(), result.durationMillis());
        telemetry.recordTurn(result);
        switch (result.outcome()) {
            case FAILED -> publisher.publishEvent(new TurnFailedEvent(result, clock.instant()));
            case CANCELLED -> LOG.debug("Turn cancelled by hangup");
            default -> publisher.publishEvent(new TurnCompletedEvent(result, clock.instant()));
        }
    }

    /** Per-turn state shared by the steps of one turn. */
    private static final class TurnRun {
        private final CallSession session;
        private final int turnNumber;
        private final CancellationToken token;
        private final AudioSink sink;
        private final long startNanos;
        private RoutingDecision served;

        private TurnRun(CallSession session, int turnNumber, CancellationToken token, AudioSink sink, long startNanos) {
            this.session = session;
            this.turnNumber = turnNumber;
            this.token = token;
            this.sink = sink;
            this.startNanos = startNanos;
        }
    }
}
