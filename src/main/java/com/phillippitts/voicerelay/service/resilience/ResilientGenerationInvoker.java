package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.RequestBuildResult;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.CircuitOpenException;
import com.phillippitts.voicerelay.exception.ExternalServiceException;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.exception.NoRouteAvailableException;
import com.phillippitts.voicerelay.exception.SegmentationException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.generation.GenerationClient;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import com.phillippitts.voicerelay.service.resilience.event.GenerationFallbackEvent;
import com.phillippitts.voicerelay.util.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Opens a generation stream through the circuit breakers, walking the degradation chain on
 * failure.
 *
 * <p>An attempt succeeds once the stream delivers its first delta. Until then, failures are
 * retried on the next candidate from {@link FallbackChain}:
 * <ul>
 *   <li>RATE_LIMITED, SERVICE_UNAVAILABLE, TRANSIENT: backoff, then the next candidate</li>
 *   <li>TIMEOUT: immediately, on a faster model</li>
 *   <li>CIRCUIT_OPEN: immediately, no network call was made</li>
 *   <li>REQUEST_INVALID: surfaced to the caller without retry</li>
 * </ul>
 * After the first delta the stream is handed over; a later ERROR delta is reported to the
 * breaker but never retried, since audio may already be playing.
 */
@Service
public class ResilientGenerationInvoker {

    private static final Logger LOG = LogManager.getLogger(ResilientGenerationInvoker.class);

    private final GenerationClient client;
    private final CircuitBreakerRegistry registry;
    private final FallbackChain chain;
    private final BackoffPolicy backoff;
    private final ResilienceProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ResilientGenerationInvoker(GenerationClient client,
                                      CircuitBreakerRegistry registry,
                                      FallbackChain chain,
                                      BackoffPolicy backoff,
                                      ResilienceProperties props,
                                      ApplicationEventPublisher publisher,
                                      Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens a stream for the routed turn.
     *
     * @param routing         decision from the selector (a degraded decision goes straight to the chain)
     * @param preferredRegion caller's region, used when placing fallback models
     * @param requestFactory  builds the request for a given route
     * @param token           turn cancellation; the open stream is closed on cancel
     * @return open stream with the route that served it
     * @throws com.phillippitts.voicerelay.exception.RequestInvalidException if the request is rejected as invalid
     * @throws NoRouteAvailableException if every candidate failed or retries ran out
     * @throws CallCancelledException    if the turn was cancelled
     */
    public ResilientStream open(RoutingDecision routing,
                                String preferredRegion,
                                Function<RoutingDecision, RequestBuildResult> requestFactory,
                                CancellationToken token) {
        Set<String> attempted = new HashSet<>();
        List<String> targets = new ArrayList<>();
        RoutingDecision current = routing;
        Throwable lastFailure = null;
        int failures = 0;

        while (true) {
            token.throwIfCancelled();
            String key = FallbackChain.attemptKey(current.modelId(), current.region());
            attempted.add(key);
            targets.add(key);

            FailureKind kind;
            boolean called = false;
            if (current.degraded()) {
                lastFailure = new ServiceUnavailableException("Model is not available in any region", current.modelId());
                kind = FailureKind.SERVICE_UNAVAILABLE;
            } else {
                try {
                    called = true;
                    return attempt(routing, current, requestFactory, token, targets.size());
                } catch (CallCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    kind = FailureKind.classify(e);
                    called = kind != FailureKind.CIRCUIT_OPEN;
                    if (kind == FailureKind.REQUEST_INVALID) {
                        LOG.error("Generation request rejected as invalid by {}@{}: {}",
                                current.modelId(), current.region(), e.getMessage());
                        throw e;
                    }
                    lastFailure = e;
                }
            }

            failures++;
            if (failures > props.getMaxRetries()) {
                throw new NoRouteAvailableException("Generation retries exhausted", targets, lastFailure);
            }
            Optional<FallbackChain.Candidate> next = chain.next(current.modelId(), current.region(), kind,
                    preferredRegion, attempted);
            if (next.isEmpty()) {
                throw new NoRouteAvailableException("Degradation chain exhausted", targets, lastFailure);
            }
            FallbackChain.Candidate candidate = next.get();
            LOG.warn("Generation attempt {} on {}@{} failed ({}); falling back to {}@{}",
                    failures, current.modelId(), current.region(), kind, candidate.modelId(), candidate.region());
            publisher.publishEvent(new GenerationFallbackEvent(current.modelId(), current.region(),
                    candidate.modelId(), candidate.region(), kind, failures, clock.instant()));

            if (called && needsBackoff(kind)) {
                try {
                    long slept = backoff.pause(failures);
                    LOG.debug("Backed off {} ms before attempt {}", slept, failures + 1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CallCancelledException("Interrupted during backoff", e);
                }
            }
            current = RoutingDecision.fallback(candidate.modelId(), candidate.region(),
                    routing.reasoningBudget(), candidate.regionFallback());
        }
    }

    private ResilientStream attempt(RoutingDecision original, RoutingDecision decision,
                                    Function<RoutingDecision, RequestBuildResult> requestFactory,
                                    CancellationToken token, int attemptNumber) {
        RequestBuildResult built = requestFactory.apply(decision);
        if (!built.isSuccess()) {
            throw built.error();
        }
        GenerationRequest request = built.request();
        String target = request.modelId();
        if (!registry.tryAcquire(target)) {
            throw new CircuitOpenException(target);
        }

        GenerationStream stream = null;
        boolean reported = false;
        try {
            stream = client.open(request);
            if (stream == null) {
                throw new SegmentationException("Generation client returned no stream for " + target);
            }
            token.onCancel(stream::close);

            TextDelta first = stream.next();
            if (first == null) {
                throw new SegmentationException("Generation stream for " + target + " ended before its first delta");
            }
            if (first.type() == TextDelta.Type.ERROR) {
                Throwable error = first.error();
                throw error instanceof RuntimeException re
                        ? re
                        : new ExternalServiceException("Generation stream failed before its first delta", target, error);
            }

            boolean degraded = !decision.modelId().equals(original.modelId()) || decision.regionFallback();
            GenerationStream handedOver = new PeekedGenerationStream(first, stream,
                    error -> registry.onFailure(target, error));
            ResilientStream result = new ResilientStream(handedOver, request, decision, degraded, attemptNumber);
            registry.onSuccess(target);
            reported = true;
            return result;
        } catch (RuntimeException e) {
            registry.onFailure(target, e);
            reported = true;
            if (stream != null) {
                stream.close();
            }
            throw e;
        } finally {
            // every acquired permission ends in exactly one outcome
            if (!reported) {
                registry.release(target);
            }
        }
    }

    private static boolean needsBackoff(FailureKind kind) {
        return switch (kind) {
            case RATE_LIMITED, SERVICE_UNAVAILABLE, TRANSIENT -> true;
            case TIMEOUT, CIRCUIT_OPEN, REQUEST_INVALID -> false;
        };
    }
}
