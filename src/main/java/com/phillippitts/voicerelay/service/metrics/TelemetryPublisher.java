package com.phillippitts.voicerelay.service.metrics;

import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.TokenUsage;
import com.phillippitts.voicerelay.domain.TurnResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Records turn telemetry off the hot path.
 *
 * <p>Every call is handed to {@code telemetryExecutor}, which discards work when saturated, so
 * a slow registry never delays a turn.
 *
 * <p><b>Null Safety:</b> a publisher built without {@link TurnMetrics} does nothing, which lets
 * the orchestrator run without metrics in tests.
 *
 * @see TurnMetrics
 */
@Component
public final class TelemetryPublisher {

    private static final Logger LOG = LogManager.getLogger(TelemetryPublisher.class);

    /** No-op instance for tests. */
    public static final TelemetryPublisher NOOP = new TelemetryPublisher(null, Runnable::run);

    private final TurnMetrics metrics;
    private final Executor executor;

    public TelemetryPublisher(TurnMetrics metrics, @Qualifier("telemetryExecutor") Executor executor) {
        this.metrics = metrics;
        this.executor = executor;
        if (metrics == null) {
            LOG.debug("TelemetryPublisher created without metrics (test mode)");
        }
    }

    public void recordRouting(RoutingDecision decision) {
        if (metrics == null) {
            return;
        }
        submit(() -> metrics.recordRoutingDecision(decision.rule(), decision.modelId(), decision.region()));
    }

    /**
     * Records a generation call's token usage and estimated cost.
     *
     * @param profile model that served the call
     * @param usage tokens reported at stream end
     */
    public void recordGeneration(ModelProfile profile, TokenUsage usage) {
        if (metrics == null || usage == null) {
            return;
        }
        submit(() -> {
            metrics.recordTokens(profile.id(), usage.inputTokens(), usage.outputTokens());
            metrics.recordCost(profile.id(), profile.estimateCost(usage.inputTokens(), usage.outputTokens()));
        });
    }

    public void recordTurn(TurnResult result) {
        if (metrics == null) {
            return;
        }
        String model = result.modelId() != null ? result.modelId() : "none";
        submit(() -> {
            metrics.recordTurnDuration(result.outcome().name(), result.durationMillis());
            metrics.incrementOutcome(result.outcome().name(), model);
            if (result.firstTokenMillis() >= 0) {
                metrics.recordFirstToken(model, result.firstTokenMillis());
            }
            if (result.firstAudioMillis() >= 0) {
                metrics.recordFirstAudio(result.firstAudioMillis());
            }
        });
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Telemetry dropped: {}", e.toString());
        }
    }
}
