/**
 * Resilience for calls to the generation and synthesis services.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.voicerelay.service.resilience.CircuitBreakerRegistry} - one resilience4j
 *       breaker per target, shared across calls</li>
 *   <li>{@link com.phillippitts.voicerelay.service.resilience.FallbackChain} - next model or
 *       region after a failure</li>
 *   <li>{@link com.phillippitts.voicerelay.service.resilience.BackoffPolicy} - exponential
 *       backoff with jitter</li>
 *   <li>{@link com.phillippitts.voicerelay.service.resilience.ResilientGenerationInvoker} and
 *       {@link com.phillippitts.voicerelay.service.resilience.ResilientSynthesis} - the
 *       call-site wrappers</li>
 * </ul>
 */
package com.phillippitts.voicerelay.service.resilience;
