/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.voicerelay.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code callId} - Call the work belongs to, set by the turn orchestrator</li>
 *   <li>{@code turn} - 1-based turn number within the call</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [turn-pool-3] [requestId] [callId] [turn] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.voicerelay.config.ThreadPoolConfig
 */
package com.phillippitts.voicerelay.config.logging;
