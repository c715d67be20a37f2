package com.phillippitts.voicerelay.presentation.controller;

import com.phillippitts.voicerelay.domain.ComplexityScore;
import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.domain.ConversationTurn;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.service.routing.ModelRegionSelector;
import com.phillippitts.voicerelay.service.scoring.ComplexityScorer;
import com.phillippitts.voicerelay.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Dry-run of scoring and routing for an utterance. No generation call is made.
 */
@RestController
@RequestMapping("/api/routing")
class RoutingController {

    private static final Logger LOG = LogManager.getLogger(RoutingController.class);

    private final ComplexityScorer scorer;
    private final ModelRegionSelector selector;

    RoutingController(ComplexityScorer scorer, ModelRegionSelector selector) {
        this.scorer = scorer;
        this.selector = selector;
    }

    @PostMapping("/preview")
    ResponseEntity<RoutingPreviewResponse> preview(@Valid @RequestBody RoutingPreviewRequest request) {
        ConversationContext context = contextFor(request);
        ComplexityScore score = scorer.score(request.utterance(), context);
        RoutingDecision decision = selector.select(score, request.latencyBudgetMs(), request.costSensitive(),
                request.needsTools(), request.region());
        LOG.info("Routing preview: rule={}, model={}, score={}, utterance='{}'",
                decision.rule(), decision.modelId(), score.value(), LogSanitizer.preview(request.utterance()));
        return ResponseEntity.ok(new RoutingPreviewResponse(score, decision));
    }

    private static ConversationContext contextFor(RoutingPreviewRequest request) {
        List<ConversationTurn> turns = new ArrayList<>(request.priorTurns());
        for (int i = 0; i < request.priorTurns(); i++) {
            turns.add(i % 2 == 0 ? ConversationTurn.caller("(earlier turn)") : ConversationTurn.agent("(earlier turn)"));
        }
        return new ConversationContext(turns, null, null, request.region(), request.needsTools(), request.multiTurn());
    }

    /** Complexity factors and the decision they led to. */
    record RoutingPreviewResponse(ComplexityScore complexity, RoutingDecision decision) {}
}
