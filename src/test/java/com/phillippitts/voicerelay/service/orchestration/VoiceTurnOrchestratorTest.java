package com.phillippitts.voicerelay.service.orchestration;

import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.config.properties.ScoringProperties;
import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.SpeakerRole;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.domain.TurnOptions;
import com.phillippitts.voicerelay.domain.TurnOutcome;
import com.phillippitts.voicerelay.domain.TurnResult;
import com.phillippitts.voicerelay.exception.NoRouteAvailableException;
import com.phillippitts.voicerelay.exception.RateLimitedException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.generation.TurnRequestBuilder;
import com.phillippitts.voicerelay.service.metrics.TelemetryPublisher;
import com.phillippitts.voicerelay.service.metrics.TurnMetrics;
import com.phillippitts.voicerelay.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.voicerelay.service.orchestration.event.TurnFailedEvent;
import com.phillippitts.voicerelay.service.resilience.BackoffPolicy;
import com.phillippitts.voicerelay.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicerelay.service.resilience.FallbackChain;
import com.phillippitts.voicerelay.service.resilience.ResilientGenerationInvoker;
import com.phillippitts.voicerelay.service.resilience.ResilientSynthesis;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.service.routing.ModelRegionSelector;
import com.phillippitts.voicerelay.service.scoring.ComplexityScorer;
import com.phillippitts.voicerelay.service.synthesis.SynthesisDispatcher;
import com.phillippitts.voicerelay.testutil.EventCapturingPublisher;
import com.phillippitts.voicerelay.testutil.FakeGenerationClient;
import com.phillippitts.voicerelay.testutil.FakeGenerationStream;
import com.phillippitts.voicerelay.testutil.FakeSynthesisClient;
import com.phillippitts.voicerelay.testutil.MutableClock;
import com.phillippitts.voicerelay.testutil.RecordingAudioSink;
import com.phillippitts.voicerelay.testutil.RoutingFixtures;
import com.phillippitts.voicerelay.testutil.SyncExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.voicerelay.testutil.RoutingFixtures.HAIKU;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.US_EAST;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.US_WEST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class VoiceTurnOrchestratorTest {

    private static final String CALL_ID = "call-42";
    private static final String UTTERANCE = "Can you confirm my appointment tomorrow?";

    private FakeGenerationClient generation;
    private FakeSynthesisClient synthesisClient;
    private EventCapturingPublisher publisher;
    private CallSessionRegistry sessions;
    private SynthesisProperties synthesisProps;
    private SimpleMeterRegistry meterRegistry;
    private RecordingAudioSink sink;
    private ExecutorService streamExecutor;
    private ExecutorService synthesisExecutor;

    @BeforeEach
    void setUp() {
        generation = new FakeGenerationClient();
        synthesisClient = new FakeSynthesisClient();
        publisher = new EventCapturingPublisher();
        MutableClock clock = new MutableClock();
        sessions = new CallSessionRegistry(clock);
        synthesisProps = new SynthesisProperties();
        meterRegistry = new SimpleMeterRegistry();
        sink = new RecordingAudioSink();
        streamExecutor = Executors.newCachedThreadPool();
        synthesisExecutor = Executors.newFixedThreadPool(4);
        sessions.startCall(CALL_ID, "tenant-a", "agent-default", US_EAST);
    }

    @AfterEach
    void tearDown() {
        streamExecutor.shutdownNow();
        synthesisExecutor.shutdownNow();
    }

    @Test
    void shouldStreamFastTierReplyInSentenceOrder() throws Exception {
        generation.respond(HAIKU, FakeGenerationStream.ofText("Yes, your appointment", " is confirmed.",
                " See you at ten."));

        TurnResult result = orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(result.modelId()).isEqualTo(HAIKU);
        assertThat(result.region()).isEqualTo(US_EAST);
        assertThat(result.turnNumber()).isEqualTo(1);
        assertThat(result.segmentsReleased()).isEqualTo(2);
        assertThat(result.spokenText()).isEqualTo("Yes, your appointment is confirmed. See you at ten.");
        assertThat(result.firstAudioMillis()).isGreaterThanOrEqualTo(0);
        assertThat(sink.sequences()).containsExactly(1, 2);
        assertThat(sink.texts()).containsExactly("Yes, your appointment is confirmed.", " See you at ten.");
        assertThat(generation.requests.get(0).reasoningBudget()).isZero();
        assertThat(publisher.find(TurnCompletedEvent.class).result()).isSameAs(result);
    }

    @Test
    void shouldAppendTurnsToConversationHistory() throws Exception {
        generation.respond(HAIKU, FakeGenerationStream.ofText("Hello there."));
        VoiceTurnOrchestrator orchestrator = orchestrator(new SyncExecutor());

        orchestrator.submitTurn(CALL_ID, "Hi.", TurnOptions.withLatencyBudget(0), sink).get(5, TimeUnit.SECONDS);
        TurnResult second = orchestrator.submitTurn(CALL_ID, "What time is it?", TurnOptions.withLatencyBudget(0),
                new RecordingAudioSink()).get(5, TimeUnit.SECONDS);

        assertThat(second.turnNumber()).isEqualTo(2);
        assertThat(generation.requests.get(1).messages()).extracting(GenerationMessage::content)
                .containsExactly("Hi.", "Hello there.", "What time is it?");
        CallSession session = sessions.find(CALL_ID).orElseThrow();
        assertThat(session.context().turns()).extracting(t -> t.role())
                .containsExactly(SpeakerRole.CALLER, SpeakerRole.AGENT, SpeakerRole.CALLER, SpeakerRole.AGENT);
    }

    @Test
    void shouldReportDegradedWhenServedFromFallbackRegion() throws Exception {
        generation.fail(HAIKU, new ServiceUnavailableException("503", HAIKU));

        TurnResult result = orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(TurnOutcome.DEGRADED);
        assertThat(result.modelId()).isEqualTo(HAIKU);
        assertThat(result.region()).isEqualTo(US_WEST);
        assertThat(sink.texts()).containsExactly("Sure thing.");
    }

    @Test
    void shouldApologizeWhenNoModelCanAnswer() throws Exception {
        generation.fail(HAIKU, new RateLimitedException("429", HAIKU));

        TurnResult result = orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(TurnOutcome.APOLOGIZED);
        assertThat(result.failure()).isInstanceOf(NoRouteAvailableException.class);
        assertThat(sink.sequences()).containsExactly(1);
        assertThat(sink.texts()).containsExactly(synthesisProps.getApologyPhrase());
        assertThat(result.spokenText()).isEqualTo(synthesisProps.getApologyPhrase());
        assertThat(sessions.find(CALL_ID).orElseThrow().context().turns()).hasSize(2);
        assertThat(publisher.find(TurnCompletedEvent.class)).isNotNull();
    }

    @Test
    void shouldApologizeAfterPartialReplyWhenStreamBreaks() throws Exception {
        generation.respond(HAIKU, FakeGenerationStream.of(
                TextDelta.content("Your order shipped. It"),
                TextDelta.error(new ServiceUnavailableException("connection reset", HAIKU))));

        TurnResult result = orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, "Where is my order?", TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(TurnOutcome.APOLOGIZED);
        assertThat(sink.sequences()).containsExactly(1, 2);
        assertThat(sink.texts()).containsExactly("Your order shipped.", synthesisProps.getApologyPhrase());
        assertThat(result.spokenText()).isEqualTo("Your order shipped. " + synthesisProps.getApologyPhrase());
        assertThat(result.segmentsReleased()).isEqualTo(2);
    }

    @Test
    void shouldFailWhenApologyCannotBePlayed() throws Exception {
        generation.fail(HAIKU, new RateLimitedException("429", HAIKU));
        synthesisClient.failAll();

        TurnResult result = orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(TurnOutcome.FAILED);
        assertThat(result.failure().getSuppressed()).isNotEmpty();
        assertThat(sink.played).isEmpty();
        TurnFailedEvent event = publisher.find(TurnFailedEvent.class);
        assertThat(event.result().callId()).isEqualTo(CALL_ID);
        assertThat(publisher.find(TurnCompletedEvent.class)).isNull();
        assertThat(sessions.find(CALL_ID).orElseThrow().context().turns())
                .extracting(t -> t.role())
                .containsExactly(SpeakerRole.CALLER);
    }

    @Test
    void shouldCancelTurnInFlightOnHangup() throws Exception {
        FakeGenerationStream stream = FakeGenerationStream.hanging(
                TextDelta.content("Let me look that up. One"));
        generation.respond(HAIKU, stream);
        ExecutorService turnExecutor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<TurnResult> turn = orchestrator(turnExecutor)
                    .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink);
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.played.size() == 1);

            assertThat(sessions.hangup(CALL_ID)).isTrue();

            TurnResult result = turn.get(5, TimeUnit.SECONDS);
            assertThat(result.outcome()).isEqualTo(TurnOutcome.CANCELLED);
            assertThat(stream.isClosed()).isTrue();
            assertThat(publisher.find(TurnCompletedEvent.class)).isNull();
            assertThat(publisher.find(TurnFailedEvent.class)).isNull();
        } finally {
            turnExecutor.shutdownNow();
        }
    }

    @Test
    void shouldRejectTurnForUnknownCall() {
        VoiceTurnOrchestrator orchestrator = orchestrator(new SyncExecutor());

        assertThatThrownBy(() -> orchestrator.submitTurn("no-such-call", UTTERANCE,
                TurnOptions.withLatencyBudget(0), sink))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-call");
    }

    @Test
    void shouldRecordTurnMetrics() throws Exception {
        orchestrator(new SyncExecutor())
                .submitTurn(CALL_ID, UTTERANCE, TurnOptions.withLatencyBudget(0), sink)
                .get(5, TimeUnit.SECONDS);

        Counter outcome = meterRegistry.find("voicerelay.turn.outcome")
                .tag("outcome", "COMPLETED")
                .tag("model", HAIKU)
                .counter();
        assertThat(outcome).isNotNull();
        assertThat(outcome.count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("voicerelay.routing.decision").tag("rule", "fast-tight").counter())
                .isNotNull();
    }

    private VoiceTurnOrchestrator orchestrator(Executor turnExecutor) {
        ResilienceProperties resilience = new ResilienceProperties();
        MutableClock clock = new MutableClock();
        ModelCatalog catalog = RoutingFixtures.catalog();
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(resilience, clock, publisher);
        BackoffPolicy backoff = new BackoffPolicy(IntervalFunction.ofExponentialBackoff(100, 2.0, 2_000), millis -> { });
        ResilientGenerationInvoker invoker = new ResilientGenerationInvoker(generation, registry,
                new FallbackChain(catalog, RoutingFixtures.availability()), backoff, resilience, publisher, clock);
        ResilientSynthesis synthesis = new ResilientSynthesis(synthesisClient, registry, backoff, resilience);
        TurnPipeline pipeline = new TurnPipeline(
                new ComplexityScorer(new ScoringProperties()),
                new ModelRegionSelector(catalog, RoutingFixtures.availability(), RoutingFixtures.routingProperties()),
                new TurnRequestBuilder(catalog, new GenerationProperties()),
                invoker,
                new SynthesisDispatcher(synthesis, synthesisExecutor, synthesisProps, publisher, clock,
                        System::nanoTime),
                synthesis);
        TelemetryPublisher telemetry = new TelemetryPublisher(new TurnMetrics(meterRegistry), new SyncExecutor());
        return new VoiceTurnOrchestrator(pipeline, sessions, turnExecutor, streamExecutor, synthesisProps,
                catalog, publisher, telemetry, clock, System::nanoTime);
    }
}
