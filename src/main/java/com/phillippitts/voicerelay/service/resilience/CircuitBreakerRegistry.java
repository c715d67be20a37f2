package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.CircuitOpenException;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.service.resilience.event.CircuitStateChangedEvent;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds one resilience4j {@link CircuitBreaker} per call target, created on first use and kept
 * for the process lifetime.
 *
 * <p>Each breaker uses a count-based window the size of the failure threshold and opens only
 * when every call in it failed, i.e. after that many consecutive failures. After the recovery
 * window a single trial call is let through (HALF_OPEN); its outcome closes or reopens the breaker.
 *
 * <p>Callers either use {@link #execute(String, Supplier)} or drive the permission and outcome
 * callbacks themselves when success is only known later (a generation stream counts as
 * successful once its first delta arrives).
 *
 * <p>Outcome recording by failure kind:
 * <ul>
 *   <li>REQUEST_INVALID, CIRCUIT_OPEN and cancellations: ignored, the permission is released</li>
 *   <li>everything else: recorded as a failure</li>
 * </ul>
 */
@Component
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, TargetBreaker> breakers = new ConcurrentHashMap<>();
    private final io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry delegate;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    public CircuitBreakerRegistry(ResilienceProperties props, Clock clock, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry.of(breakerConfig(props));
    }

    static CircuitBreakerConfig breakerConfig(ResilienceProperties props) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(props.getFailureThreshold())
                .minimumNumberOfCalls(props.getFailureThreshold())
                .failureRateThreshold(100)
                .waitDurationInOpenState(Duration.ofMillis(props.getRecoveryWindowMs()))
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreException(failure -> !countsAsFailure(failure))
                .build();
    }

    public CircuitBreaker breaker(String target) {
        return entry(target).breaker();
    }

    /**
     * Asks permission to call a target.
     *
     * @return true if the call may proceed; the caller must then report exactly one of
     *         {@link #onSuccess(String)}, {@link #onFailure(String, Throwable)} or {@link #release(String)}
     */
    public boolean tryAcquire(String target) {
        return breaker(target).tryAcquirePermission();
    }

    public void onSuccess(String target) {
        breaker(target).onSuccess(0, TimeUnit.NANOSECONDS);
    }

    /**
     * Reports a failed call. Invalid requests and cancellations release the permission without
     * counting as failures.
     */
    public void onFailure(String target, Throwable failure) {
        breaker(target).onError(0, TimeUnit.NANOSECONDS, failure);
    }

    public void release(String target) {
        breaker(target).releasePermission();
    }

    /**
     * Runs a call through the target's breaker.
     *
     * @throws CircuitOpenException if the breaker rejects the call; no call is made
     */
    public <T> T execute(String target, Supplier<T> call) {
        try {
            return breaker(target).executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(target, e);
        }
    }

    public CircuitState state(String target) {
        TargetBreaker entry = breakers.get(target);
        return entry == null ? CircuitState.CLOSED : toState(entry.breaker().getState());
    }

    public CircuitSnapshot snapshot(String target) {
        return entry(target).snapshot();
    }

    /** Snapshots of every known breaker, sorted by target. */
    public List<CircuitSnapshot> snapshots() {
        return breakers.values().stream()
                .map(TargetBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::target))
                .toList();
    }

    static boolean countsAsFailure(Throwable failure) {
        if (failure instanceof CallCancelledException) {
            return false;
        }
        FailureKind kind = FailureKind.classify(failure);
        return kind != FailureKind.REQUEST_INVALID && kind != FailureKind.CIRCUIT_OPEN;
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        List<CircuitSnapshot> notClosed = snapshots().stream()
                .filter(s -> s.state() != CircuitState.CLOSED)
                .toList();
        if (!notClosed.isEmpty()) {
            StringBuilder sb = new StringBuilder("Circuit states: ");
            notClosed.forEach(s -> sb.append(s.target()).append('=').append(s.state()).append(' '));
            LOG.info(sb.toString().trim());
        }
    }

    private TargetBreaker entry(String target) {
        return breakers.computeIfAbsent(target, this::create);
    }

    private TargetBreaker create(String target) {
        TargetBreaker entry = new TargetBreaker(target, delegate.circuitBreaker(target), new AtomicReference<>());
        CircuitBreaker.EventPublisher events = entry.breaker().getEventPublisher();
        events.onError(e -> entry.lastFailureAt().set(clock.instant()));
        events.onStateTransition(e -> publishTransition(entry,
                toState(e.getStateTransition().getFromState()),
                toState(e.getStateTransition().getToState())));
        return entry;
    }

    private void publishTransition(TargetBreaker entry, CircuitState from, CircuitState to) {
        if (from == to) {
            return;
        }
        int failed = entry.breaker().getMetrics().getNumberOfFailedCalls();
        if (to == CircuitState.OPEN) {
            LOG.warn("Circuit {} {} -> OPEN after {} failed calls", entry.target(), from, failed);
        } else {
            LOG.info("Circuit {} {} -> {}", entry.target(), from, to);
        }
        publisher.publishEvent(new CircuitStateChangedEvent(entry.target(), from, to, failed, clock.instant()));
    }

    static CircuitState toState(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    private record TargetBreaker(String target, CircuitBreaker breaker, AtomicReference<Instant> lastFailureAt) {

        CircuitSnapshot snapshot() {
            CircuitBreaker.Metrics metrics = breaker.getMetrics();
            return new CircuitSnapshot(target, toState(breaker.getState()),
                    metrics.getNumberOfFailedCalls(), metrics.getNumberOfSuccessfulCalls(), lastFailureAt.get());
        }
    }
}
