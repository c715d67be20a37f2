/**
 * Application-wide configuration beans and properties.
 *
 * <p>This package contains Spring configuration classes that define beans and load
 * externalized configuration from {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voicerelay.config.ThreadPoolConfig} - Turn, stream, synthesis
 *       and telemetry executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.voicerelay.config.ThreadPoolMetricsConfig} - Pool gauges</li>
 *   <li>{@link com.phillippitts.voicerelay.config.RoutingConfig} - Model catalog, region
 *       availability and clock beans</li>
 *   <li>{@link com.phillippitts.voicerelay.config.RoutingConfigurationValidator} - Fails startup
 *       on an inconsistent model catalog</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} classes</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 *   <li>{@code config.orchestration} - Explicit wiring of the turn orchestrator</li>
 * </ul>
 */
package com.phillippitts.voicerelay.config;
