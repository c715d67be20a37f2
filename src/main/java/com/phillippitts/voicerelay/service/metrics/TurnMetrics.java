package com.phillippitts.voicerelay.service.metrics;

import com.phillippitts.voicerelay.service.resilience.event.GenerationFallbackEvent;
import com.phillippitts.voicerelay.service.synthesis.event.SegmentSynthesisFailedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for voice turns.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn duration, first-token and first-audio latency</li>
 *   <li>Turn outcomes and routing decisions per model</li>
 *   <li>Generation token counts and estimated cost</li>
 *   <li>Fallbacks and synthesis failures, counted from application events</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TurnMetrics {

    private static final String METRIC_PREFIX = "voicerelay";

    private final MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records total turn duration.
     *
     * @param outcome turn outcome name
     * @param durationMillis turn duration in milliseconds
     */
    public void recordTurnDuration(String outcome, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".turn.duration")
                .description("Time from turn submission to the end of playback dispatch")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void recordFirstToken(String model, long millis) {
        Timer.builder(METRIC_PREFIX + ".turn.first_token")
                .description("Time from generation request to the first streamed token")
                .tag("model", model)
                .register(registry)
                .record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordFirstAudio(long millis) {
        Timer.builder(METRIC_PREFIX + ".turn.first_audio")
                .description("Time from turn start to the first audio released to the caller")
                .register(registry)
                .record(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Increments the outcome counter.
     *
     * @param outcome turn outcome name
     * @param model model that served the turn, or "none"
     */
    public void incrementOutcome(String outcome, String model) {
        Counter.builder(METRIC_PREFIX + ".turn.outcome")
                .description("Number of turns by outcome")
                .tag("outcome", outcome)
                .tag("model", model)
                .register(registry)
                .increment();
    }

    /**
     * Records which routing rule picked which model and region.
     */
    public void recordRoutingDecision(String rule, String model, String region) {
        Counter.builder(METRIC_PREFIX + ".routing.decision")
                .description("Number of routing decisions by rule, model and region")
                .tag("rule", rule)
                .tag("model", model)
                .tag("region", region)
                .register(registry)
                .increment();
    }

    public void recordTokens(String model, long inputTokens, long outputTokens) {
        DistributionSummary.builder(METRIC_PREFIX + ".generation.tokens")
                .description("Tokens per generation call")
                .baseUnit("tokens")
                .tag("model", model)
                .tag("direction", "input")
                .register(registry)
                .record(inputTokens);
        DistributionSummary.builder(METRIC_PREFIX + ".generation.tokens")
                .description("Tokens per generation call")
                .baseUnit("tokens")
                .tag("model", model)
                .tag("direction", "output")
                .register(registry)
                .record(outputTokens);
    }

    /**
     * Adds to the estimated generation spend.
     *
     * @param model model identifier
     * @param usd estimated cost in US dollars
     */
    public void recordCost(String model, double usd) {
        Counter.builder(METRIC_PREFIX + ".generation.cost")
                .description("Estimated generation cost")
                .baseUnit("usd")
                .tag("model", model)
                .register(registry)
                .increment(usd);
    }

    @EventListener
    public void onFallback(GenerationFallbackEvent event) {
        Counter.builder(METRIC_PREFIX + ".resilience.fallback")
                .description("Number of generation fallbacks by failure kind")
                .tag("kind", event.kind().name())
                .tag("from", event.fromModel())
                .tag("to", event.toModel())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onSynthesisFailure(SegmentSynthesisFailedEvent event) {
        Counter.builder(METRIC_PREFIX + ".synthesis.failure")
                .description("Number of segments whose synthesis failed")
                .tag("kind", event.kind().name())
                .register(registry)
                .increment();
    }
}
