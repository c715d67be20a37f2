package com.phillippitts.voicerelay.service.scoring;

import com.phillippitts.voicerelay.config.properties.ScoringProperties;
import com.phillippitts.voicerelay.domain.ConversationContext;

/**
 * Computes the context contribution to a complexity score.
 *
 * <p>Signals in priority order: long history, anticipated tool use, multi-turn flag.
 */
@FunctionalInterface
public interface ContextFactorPolicy {

    double contextFactor(ConversationContext context);

    /**
     * Builds the policy configured in {@link ScoringProperties#getContextPolicy()}.
     */
    static ContextFactorPolicy from(ScoringProperties props) {
        return switch (props.getContextPolicy()) {
            case FIRST_MATCH -> firstMatch(props);
            case ADDITIVE -> additive(props);
        };
    }

    /** Only the highest-priority matching signal contributes. */
    static ContextFactorPolicy firstMatch(ScoringProperties props) {
        return ctx -> {
            if (ctx.priorTurnCount() > props.getLongHistoryTurns()) {
                return props.getLongHistoryFactor();
            }
            if (ctx.toolsAnticipated()) {
                return props.getToolsFactor();
            }
            if (ctx.multiTurn()) {
                return props.getMultiTurnFactor();
            }
            return 0.0;
        };
    }

    /** Every matching signal contributes; the overall score is capped by the scorer. */
    static ContextFactorPolicy additive(ScoringProperties props) {
        return ctx -> {
            double factor = 0.0;
            if (ctx.priorTurnCount() > props.getLongHistoryTurns()) {
                factor += props.getLongHistoryFactor();
            }
            if (ctx.toolsAnticipated()) {
                factor += props.getToolsFactor();
            }
            if (ctx.multiTurn()) {
                factor += props.getMultiTurnFactor();
            }
            return factor;
        };
    }
}
