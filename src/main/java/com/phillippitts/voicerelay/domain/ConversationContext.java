package com.phillippitts.voicerelay.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a call's conversation state.
 *
 * <p>The owning call session replaces its snapshot on every finalized turn via
 * {@link #append(ConversationTurn)}, so readers (scorer, request builder) always see a
 * consistent, ordered history.
 *
 * @param turns            prior turns in the order they were finalized
 * @param tenantId         tenant owning the call
 * @param agentConfigRef   reference to the agent configuration serving the call
 * @param regionHint       preferred serving region (nullable, defaults from configuration)
 * @param toolsAnticipated whether the agent expects to call tools on this call
 * @param multiTurn        whether the call is flagged as a multi-turn dialogue
 */
public record ConversationContext(
        List<ConversationTurn> turns,
        String tenantId,
        String agentConfigRef,
        String regionHint,
        boolean toolsAnticipated,
        boolean multiTurn
) {

    public ConversationContext {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    /** An empty context with no tenant, agent or region information. */
    public static ConversationContext empty() {
        return new ConversationContext(List.of(), null, null, null, false, false);
    }

    /** Starts a new call context for a tenant and agent. */
    public static ConversationContext start(String tenantId, String agentConfigRef, String regionHint) {
        return new ConversationContext(List.of(), tenantId, agentConfigRef, regionHint, false, false);
    }

    public int priorTurnCount() {
        return turns.size();
    }

    /**
     * Returns a new context with the turn appended.
     *
     * @param turn finalized turn (must not be null)
     * @return new context; this instance is unchanged
     */
    public ConversationContext append(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        List<ConversationTurn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return new ConversationContext(next, tenantId, agentConfigRef, regionHint, toolsAnticipated, multiTurn);
    }

    public ConversationContext withToolsAnticipated(boolean anticipated) {
        return new ConversationContext(turns, tenantId, agentConfigRef, regionHint, anticipated, multiTurn);
    }

    public ConversationContext withMultiTurn(boolean flagged) {
        return new ConversationContext(turns, tenantId, agentConfigRef, regionHint, toolsAnticipated, flagged);
    }
}
