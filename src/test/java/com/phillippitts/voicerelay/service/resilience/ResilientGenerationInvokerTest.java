package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.RequestBuildResult;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.exception.NoRouteAvailableException;
import com.phillippitts.voicerelay.exception.RateLimitedException;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.exception.ServiceTimeoutException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import com.phillippitts.voicerelay.service.resilience.event.GenerationFallbackEvent;
import com.phillippitts.voicerelay.testutil.EventCapturingPublisher;
import com.phillippitts.voicerelay.testutil.FakeGenerationClient;
import com.phillippitts.voicerelay.testutil.FakeGenerationStream;
import com.phillippitts.voicerelay.testutil.MutableClock;
import com.phillippitts.voicerelay.testutil.RoutingFixtures;
import com.phillippitts.voicerelay.util.CancellationToken;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.phillippitts.voicerelay.testutil.RoutingFixtures.EU_CENTRAL;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.HAIKU;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.HAIKU_35;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.OPUS;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.SONNET;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.US_EAST;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.US_WEST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientGenerationInvokerTest {

    private static final Function<RoutingDecision, RequestBuildResult> REQUESTS = decision ->
            RequestBuildResult.success(new GenerationRequest(decision.modelId(), decision.region(), "Be brief.",
                    List.of(GenerationMessage.user("What are your hours?")), 300, 0.3, List.of(),
                    decision.reasoningBudget()));

    private FakeGenerationClient client;
    private EventCapturingPublisher publisher;
    private CircuitBreakerRegistry registry;
    private ResilienceProperties props;
    private List<Long> sleeps;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        client = new FakeGenerationClient();
        publisher = new EventCapturingPublisher();
        props = new ResilienceProperties();
        MutableClock clock = new MutableClock();
        registry = new CircuitBreakerRegistry(props, clock, publisher);
        sleeps = new ArrayList<>();
        token = new CancellationToken("call-1");
    }

    @Test
    void shouldReturnStreamPositionedAtFirstDelta() {
        client.respond(SONNET, FakeGenerationStream.ofText("We open at nine."));

        ResilientStream result = invoker().open(route(SONNET), US_EAST, REQUESTS, token);

        assertThat(result.served().modelId()).isEqualTo(SONNET);
        assertThat(result.degraded()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.stream().next()).isEqualTo(TextDelta.content("We open at nine."));
        assertThat(result.stream().next().type()).isEqualTo(TextDelta.Type.END);
        assertThat(registry.snapshot(SONNET).successfulCalls()).isEqualTo(1);
    }

    @Test
    void shouldMoveToFasterModelOnTimeoutWithoutBackoff() {
        client.fail(OPUS, new ServiceTimeoutException("slow", OPUS));

        ResilientStream result = invoker().open(route(OPUS), US_EAST, REQUESTS, token);

        assertThat(client.requestedModels()).containsExactly(OPUS, SONNET);
        assertThat(result.degraded()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(sleeps).isEmpty();
        GenerationFallbackEvent event = publisher.find(GenerationFallbackEvent.class);
        assertThat(event.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(event.fromModel()).isEqualTo(OPUS);
        assertThat(event.toModel()).isEqualTo(SONNET);
    }

    @Test
    void shouldBackOffBeforeNextModelOnRateLimit() {
        client.fail(SONNET, new RateLimitedException("429", SONNET));

        ResilientStream result = invoker().open(route(SONNET), US_EAST, REQUESTS, token);

        assertThat(result.served().modelId()).isEqualTo(HAIKU_35);
        assertThat(sleeps).containsExactly(100L);
    }

    @Test
    void shouldTrySameModelInAnotherRegionWhenUnavailable() {
        client.fail(SONNET, new ServiceUnavailableException("503", SONNET));

        ResilientStream result = invoker().open(route(SONNET), US_EAST, REQUESTS, token);

        assertThat(result.served().modelId()).isEqualTo(SONNET);
        assertThat(result.served().region()).isEqualTo(US_WEST);
        assertThat(result.served().regionFallback()).isTrue();
        assertThat(result.degraded()).isTrue();
    }

    @Test
    void shouldSurfaceInvalidRequestWithoutRetry() {
        client.fail(SONNET, new RequestInvalidException("400", SONNET));

        assertThatThrownBy(() -> invoker().open(route(SONNET), US_EAST, REQUESTS, token))
                .isInstanceOf(RequestInvalidException.class);
        assertThat(client.requestedModels()).containsExactly(SONNET);
        assertThat(publisher.eventsOf(GenerationFallbackEvent.class)).isEmpty();
        assertThat(registry.state(SONNET)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldSurfaceRequestBuildFailure() {
        Function<RoutingDecision, RequestBuildResult> failing =
                decision -> RequestBuildResult.failure(new RequestInvalidException("unknown model", decision.modelId()));

        assertThatThrownBy(() -> invoker().open(route(SONNET), US_EAST, failing, token))
                .isInstanceOf(RequestInvalidException.class);
        assertThat(client.requests).isEmpty();
    }

    @Test
    void shouldSkipOpenCircuitWithoutCallingOrSleeping() {
        for (int i = 0; i < props.getFailureThreshold(); i++) {
            registry.onFailure(OPUS, new ServiceUnavailableException("down", OPUS));
        }

        ResilientStream result = invoker().open(route(OPUS), US_EAST, REQUESTS, token);

        assertThat(client.callsFor(OPUS)).isZero();
        assertThat(result.served().modelId()).isEqualTo(SONNET);
        assertThat(sleeps).isEmpty();
        assertThat(publisher.find(GenerationFallbackEvent.class).kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
    }

    @Test
    void shouldThrowNoRouteWhenChainIsExhausted() {
        client.fail(HAIKU, new RateLimitedException("429", HAIKU));

        assertThatThrownBy(() -> invoker().open(route(HAIKU), US_EAST, REQUESTS, token))
                .isInstanceOf(NoRouteAvailableException.class)
                .satisfies(e -> assertThat(((NoRouteAvailableException) e).getAttemptedTargets())
                        .containsExactly(HAIKU + "@" + US_EAST))
                .hasCauseInstanceOf(RateLimitedException.class);
    }

    @Test
    void shouldStopAfterMaxRetries() {
        props.setMaxRetries(1);
        client.fail(OPUS, new RateLimitedException("429", OPUS));
        client.fail(SONNET, new RateLimitedException("429", SONNET));

        assertThatThrownBy(() -> invoker().open(route(OPUS), US_EAST, REQUESTS, token))
                .isInstanceOf(NoRouteAvailableException.class);
        assertThat(client.requestedModels()).containsExactly(OPUS, SONNET);
    }

    @Test
    void shouldNotCallDegradedRouteAndPlaceModelElsewhere() {
        RoutingDecision degraded = new RoutingDecision(OPUS, EU_CENTRAL, 0, "capable", false, true);

        ResilientStream result = invoker().open(degraded, EU_CENTRAL, REQUESTS, token);

        assertThat(client.requests).hasSize(1);
        assertThat(client.requests.get(0).region()).isEqualTo(US_EAST);
        assertThat(result.degraded()).isTrue();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldTreatErrorAsFirstDeltaAsFailure() {
        FakeGenerationStream broken = FakeGenerationStream.of(
                TextDelta.error(new ServiceUnavailableException("overloaded", SONNET)));
        client.respond(SONNET, broken);

        ResilientStream result = invoker().open(route(SONNET), US_EAST, REQUESTS, token);

        assertThat(broken.isClosed()).isTrue();
        assertThat(registry.snapshot(SONNET).lastFailureAt()).isNotNull();
        assertThat(result.served().region()).isEqualTo(US_WEST);
        assertThat(client.requests).hasSize(2);
    }

    @Test
    void shouldReportMidStreamErrorToBreakerWithoutRetry() {
        client.respond(SONNET, FakeGenerationStream.of(
                TextDelta.content("Let me check."),
                TextDelta.error(new ServiceUnavailableException("dropped", SONNET))));

        ResilientStream result = invoker().open(route(SONNET), US_EAST, REQUESTS, token);
        result.stream().next();
        TextDelta error = result.stream().next();

        assertThat(error.type()).isEqualTo(TextDelta.Type.ERROR);
        assertThat(registry.snapshot(SONNET).failedCalls()).isEqualTo(1);
        assertThat(client.requests).hasSize(1);
    }

    @Test
    void shouldCloseOpenStreamOnCancel() {
        FakeGenerationStream stream = FakeGenerationStream.hanging(TextDelta.content("One moment."));
        client.respond(SONNET, stream);

        invoker().open(route(SONNET), US_EAST, REQUESTS, token);
        token.cancel();

        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    void shouldRefuseToStartWhenAlreadyCancelled() {
        token.cancel();

        assertThatThrownBy(() -> invoker().open(route(SONNET), US_EAST, REQUESTS, token))
                .isInstanceOf(CallCancelledException.class);
        assertThat(client.requests).isEmpty();
    }

    @Test
    void shouldSettleHalfOpenTrialWhenStreamEndsWithoutFirstDelta() throws Exception {
        props.setRecoveryWindowMs(50);
        registry = new CircuitBreakerRegistry(props, new MutableClock(), publisher);
        tripBreaker(OPUS);
        Thread.sleep(150);
        FakeGenerationStream empty = FakeGenerationStream.of();
        client.respond(OPUS, new GenerationStream() {
            @Override
            public TextDelta next() {
                return null;
            }

            @Override
            public void close() {
                empty.close();
            }
        });

        ResilientStream result = invoker().open(route(OPUS), US_EAST, REQUESTS, token);

        assertThat(result.served().modelId()).isNotEqualTo(OPUS);
        assertThat(empty.isClosed()).isTrue();
        assertThat(registry.state(OPUS)).isEqualTo(CircuitState.OPEN);
        Thread.sleep(150);
        assertThat(registry.tryAcquire(OPUS)).isTrue();
    }

    @Test
    void shouldSettleHalfOpenTrialWhenClientReturnsNoStream() throws Exception {
        props.setRecoveryWindowMs(50);
        registry = new CircuitBreakerRegistry(props, new MutableClock(), publisher);
        tripBreaker(OPUS);
        Thread.sleep(150);
        client.respond(OPUS, null);

        ResilientStream result = invoker().open(route(OPUS), US_EAST, REQUESTS, token);

        assertThat(result.served().modelId()).isNotEqualTo(OPUS);
        assertThat(registry.snapshot(OPUS).lastFailureAt()).isNotNull();
        Thread.sleep(150);
        assertThat(registry.tryAcquire(OPUS)).isTrue();
    }

    private void tripBreaker(String target) {
        for (int i = 0; i < props.getFailureThreshold(); i++) {
            registry.onFailure(target, new ServiceUnavailableException("down", target));
        }
        assertThat(registry.state(target)).isEqualTo(CircuitState.OPEN);
    }

    private ResilientGenerationInvoker invoker() {
        FallbackChain chain = new FallbackChain(RoutingFixtures.catalog(), RoutingFixtures.availability());
        BackoffPolicy backoff = new BackoffPolicy(IntervalFunction.ofExponentialBackoff(100, 2.0, 2_000), sleeps::add);
        return new ResilientGenerationInvoker(client, registry, chain, backoff, props, publisher,
                new MutableClock());
    }

    private static RoutingDecision route(String modelId) {
        return new RoutingDecision(modelId, US_EAST, 0, "test", false, false);
    }
}
