package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Exponential backoff with jitter, computed by a resilience4j {@link IntervalFunction}.
 *
 * <p>The nominal delay for attempt {@code n} (1-based) is {@code base * 2^(n-1)}, capped at the
 * configured maximum, then randomized by {@code jitterRatio} either way.
 */
@Component
public class BackoffPolicy {

    /** Blocking pause, swappable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final IntervalFunction intervals;
    private final Sleeper sleeper;

    @Autowired
    public BackoffPolicy(ResilienceProperties props) {
        this(IntervalFunction.ofExponentialRandomBackoff(props.getBackoffBaseMs(), 2.0,
                props.getJitterRatio(), props.getBackoffMaxMs()), Thread::sleep);
    }

    public BackoffPolicy(IntervalFunction intervals, Sleeper sleeper) {
        this.intervals = Objects.requireNonNull(intervals, "intervals");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Delay before the given retry.
     *
     * @param attempt 1-based retry number
     * @return delay in milliseconds, never negative
     */
    public long delayMillis(int attempt) {
        return Math.max(0L, intervals.apply(Math.max(1, attempt)));
    }

    /**
     * Sleeps for {@link #delayMillis(int)}.
     *
     * @return the delay slept
     */
    public long pause(int attempt) throws InterruptedException {
        long delay = delayMillis(attempt);
        if (delay > 0) {
            sleeper.sleep(delay);
        }
        return delay;
    }
}
