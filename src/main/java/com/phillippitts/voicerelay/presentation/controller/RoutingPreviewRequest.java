package com.phillippitts.voicerelay.presentation.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of {@code POST /api/routing/preview}.
 *
 * @param utterance       caller text to score
 * @param latencyBudgetMs time-to-first-token budget
 * @param costSensitive   prefer cheaper models
 * @param needsTools      the turn would expose tools
 * @param region          preferred region (nullable)
 * @param priorTurns      number of earlier turns in the call
 * @param multiTurn       the call is flagged multi-turn
 */
record RoutingPreviewRequest(
        @NotNull(message = "utterance must be provided") String utterance,
        @PositiveOrZero long latencyBudgetMs,
        boolean costSensitive,
        boolean needsTools,
        String region,
        @Min(0) @Max(1000) int priorTurns,
        boolean multiTurn
) {}
