package com.phillippitts.voicerelay.service.metrics;

import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.TokenUsage;
import com.phillippitts.voicerelay.domain.TurnOutcome;
import com.phillippitts.voicerelay.domain.TurnResult;
import com.phillippitts.voicerelay.testutil.RoutingFixtures;
import com.phillippitts.voicerelay.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;

class TelemetryPublisherTest {

    private SimpleMeterRegistry registry;
    private TelemetryPublisher telemetry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        telemetry = new TelemetryPublisher(new TurnMetrics(registry), new SyncExecutor());
    }

    @Test
    void shouldRecordRoutingDecision() {
        telemetry.recordRouting(new RoutingDecision("claude-3-haiku", "us-east-1", 0, "fast-tight", false, false));

        assertThat(registry.find("voicerelay.routing.decision").tag("rule", "fast-tight").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldEstimateCostFromModelPrices() {
        telemetry.recordGeneration(RoutingFixtures.catalog().find(RoutingFixtures.HAIKU).orElseThrow(),
                new TokenUsage(1_000_000, 1_000_000));

        assertThat(registry.find("voicerelay.generation.cost").counter().count()).isCloseTo(1.50, within(1e-9));
    }

    @Test
    void shouldSkipLatenciesThatWereNotMeasured() {
        telemetry.recordTurn(new TurnResult("call-1", 1, TurnOutcome.FAILED, null, null, "", 0, List.of(),
                -1, -1, 12, null));

        assertThat(registry.find("voicerelay.turn.outcome").tag("model", "none").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("voicerelay.turn.first_token").timer()).isNull();
        assertThat(registry.find("voicerelay.turn.first_audio").timer()).isNull();
    }

    @Test
    void shouldDropTelemetryWhenExecutorIsSaturated() {
        TelemetryPublisher saturated = new TelemetryPublisher(new TurnMetrics(registry), task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatCode(() -> saturated.recordRouting(
                new RoutingDecision("claude-3-haiku", "us-east-1", 0, "fast", false, false)))
                .doesNotThrowAnyException();
        assertThat(registry.getMeters()).isEmpty();
    }

    @Test
    void shouldDoNothingWithoutMetrics() {
        assertThat(TelemetryPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> TelemetryPublisher.NOOP.recordGeneration(null, TokenUsage.NONE))
                .doesNotThrowAnyException();
    }
}
