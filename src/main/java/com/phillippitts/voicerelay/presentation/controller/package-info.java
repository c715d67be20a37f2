/**
 * REST API controllers for the diagnostics surface.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code RoutingController} - {@code POST /api/routing/preview} scores an utterance and
 *       shows the routing decision without calling the model</li>
 *   <li>{@code CircuitController} - {@code GET /api/circuits} lists every circuit breaker</li>
 * </ul>
 *
 * <p>Exceptions are left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.voicerelay.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicerelay.presentation.controller;
