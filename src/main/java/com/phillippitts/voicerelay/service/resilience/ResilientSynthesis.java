package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.service.synthesis.SynthesisClient;
import com.phillippitts.voicerelay.service.synthesis.VoiceSettings;
import com.phillippitts.voicerelay.util.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Synthesis calls through the breaker of target {@code synthesis:<voice>}, retried a
 * configurable number of times with the same backoff as generation.
 *
 * <p>Invalid requests and open circuits are not retried; timeouts are retried without backoff.
 */
@Component
public class ResilientSynthesis {

    private static final Logger LOG = LogManager.getLogger(ResilientSynthesis.class);

    private final SynthesisClient client;
    private final CircuitBreakerRegistry registry;
    private final BackoffPolicy backoff;
    private final int retries;

    public ResilientSynthesis(SynthesisClient client, CircuitBreakerRegistry registry,
                              BackoffPolicy backoff, ResilienceProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.retries = props.getSynthesisRetries();
    }

    /**
     * @return audio bytes
     * @throws RuntimeException the last failure once retries are used up
     * @throws CallCancelledException if the turn was cancelled
     */
    public byte[] synthesize(String text, VoiceSettings voice, CancellationToken token) {
        String target = voice.breakerTarget();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= retries + 1; attempt++) {
            token.throwIfCancelled();
            try {
                return registry.execute(target, () -> client.synthesize(text, voice));
            } catch (CallCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                FailureKind kind = FailureKind.classify(e);
                if (kind == FailureKind.REQUEST_INVALID || kind == FailureKind.CIRCUIT_OPEN || attempt > retries) {
                    break;
                }
                LOG.debug("Synthesis attempt {} failed ({}), retrying", attempt, kind);
                if (kind != FailureKind.TIMEOUT) {
                    pause(attempt);
                }
            }
        }
        throw last;
    }

    private void pause(int attempt) {
        try {
            backoff.pause(attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Interrupted during synthesis backoff", e);
        }
    }
}
