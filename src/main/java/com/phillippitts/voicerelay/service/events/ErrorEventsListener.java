package com.phillippitts.voicerelay.service.events;

import com.phillippitts.voicerelay.service.orchestration.event.TurnFailedEvent;
import com.phillippitts.voicerelay.service.resilience.CircuitState;
import com.phillippitts.voicerelay.service.resilience.event.CircuitStateChangedEvent;
import com.phillippitts.voicerelay.service.resilience.event.GenerationFallbackEvent;
import com.phillippitts.voicerelay.service.synthesis.event.SegmentSynthesisFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operational failure events. Throttled per key to avoid log spam
 * during an outage; transcript text never reaches these logs.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCircuitStateChanged(CircuitStateChangedEvent e) {
        if (e.to() == CircuitState.CLOSED) {
            LOG.info("Circuit closed again: target={}", e.target());
            return;
        }
        if (shouldLog("circuit-" + e.target() + '-' + e.to())) {
            LOG.warn("Circuit {} for target={} after {} failed calls. Calls will fail fast until recovery.",
                    e.to(), e.target(), e.failedCalls());
        }
    }

    @EventListener
    void onFallback(GenerationFallbackEvent e) {
        String key = "fallback-" + e.fromModel() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Generation falling back: {}@{} -> {}@{} ({}). Check the provider status for {}.",
                    e.fromModel(), e.fromRegion(), e.toModel(), e.toRegion(), e.kind(), e.fromModel());
        }
    }

    @EventListener
    void onSegmentSynthesisFailed(SegmentSynthesisFailedEvent e) {
        if (shouldLog("synthesis-" + e.kind())) {
            LOG.warn("Segment synthesis failing: kind={}, reason={}. Check voicerelay.synthesis.* settings.",
                    e.kind(), e.reason());
        }
    }

    @EventListener
    void onTurnFailed(TurnFailedEvent e) {
        String reason = e.result().failure() == null ? "unknown" : e.result().failure().getClass().getSimpleName();
        if (shouldLog("turn-failed-" + reason)) {
            LOG.warn("Turn produced no audio: callId={}, turn={}, reason={}",
                    e.result().callId(), e.result().turnNumber(), reason);
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
