package com.phillippitts.voicerelay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit breaker, retry and backoff settings, bound from {@code voicerelay.resilience.*}.
 */
@ConfigurationProperties(prefix = "voicerelay.resilience")
@Validated
public class ResilienceProperties {

    /** Consecutive failures that open a circuit. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 5;

    /** Time since the last failure after which an open circuit allows one trial call. */
    @Positive(message = "Recovery window must be positive")
    private long recoveryWindowMs = 30_000;

    /** Additional generation attempts after the first, across the degradation chain. */
    @PositiveOrZero
    private int maxRetries = 3;

    @Positive
    private long backoffBaseMs = 100;

    @Positive
    private long backoffMaxMs = 2_000;

    /** Randomization factor for backoff delays: each delay varies by up to this fraction either way (0 = none). */
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double jitterRatio = 0.5;

    /** Retries per synthesis segment after the first attempt. */
    @PositiveOrZero
    private int synthesisRetries = 1;

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getRecoveryWindowMs() {
        return recoveryWindowMs;
    }

    public void setRecoveryWindowMs(long recoveryWindowMs) {
        this.recoveryWindowMs = recoveryWindowMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public int getSynthesisRetries() {
        return synthesisRetries;
    }

    public void setSynthesisRetries(int synthesisRetries) {
        this.synthesisRetries = synthesisRetries;
    }
}
