package com.phillippitts.voicerelay.service.generation;

import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.domain.ConversationTurn;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.RequestBuildResult;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.SpeakerRole;
import com.phillippitts.voicerelay.domain.ToolSpec;
import com.phillippitts.voicerelay.domain.TurnOptions;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles the outbound generation request for one turn, honoring the chosen model's limits.
 *
 * <ul>
 *   <li>max tokens: requested value (or the configured default), capped at the model ceiling</li>
 *   <li>temperature: requested value, or the configured default (0.3)</li>
 *   <li>system prompt: agent prompt plus {@link VoiceDeliveryGuidelines}</li>
 *   <li>tools: attached only when the model supports tools</li>
 *   <li>reasoning budget: attached only when routed with one and the model supports it,
 *       clamped to the model maximum</li>
 * </ul>
 *
 * <p>An unknown model id is a configuration error. It is returned as a failed
 * {@link RequestBuildResult}; the builder never substitutes another model.
 */
@Service
public class TurnRequestBuilder {

    private static final Logger LOG = LogManager.getLogger(TurnRequestBuilder.class);

    private final ModelCatalog catalog;
    private final GenerationProperties props;

    public TurnRequestBuilder(ModelCatalog catalog, GenerationProperties props) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.props = Objects.requireNonNull(props, "props");
    }

    public RequestBuildResult build(String utterance, ConversationContext context,
                                    RoutingDecision routing, TurnOptions options) {
        Optional<ModelProfile> found = catalog.find(routing.modelId());
        if (found.isEmpty()) {
            LOG.error("Routing selected model '{}' which is not in the model catalog", routing.modelId());
            return RequestBuildResult.failure(new RequestInvalidException(
                    "Model is not in the model catalog", routing.modelId()));
        }
        ModelProfile model = found.get();
        TurnOptions opts = options == null ? TurnOptions.withLatencyBudget(0) : options;

        int reasoningBudget = routing.reasoningBudget() > 0 && model.supportsExtendedReasoning()
                ? Math.min(routing.reasoningBudget(), model.maxReasoningBudget())
                : 0;
        int requested = opts.maxTokens() > 0 ? opts.maxTokens() : props.getDefaultMaxTokens();
        // reasoning tokens count against max_tokens
        int maxTokens = Math.min(requested + reasoningBudget, model.maxOutputTokens());
        if (reasoningBudget >= maxTokens) {
            reasoningBudget = 0;
            maxTokens = Math.min(requested, model.maxOutputTokens());
        }
        double temperature = opts.temperature() != null ? opts.temperature() : props.getTemperature();
        List<ToolSpec> tools = model.supportsTools() ? opts.tools() : List.of();
        if (!model.supportsTools() && opts.needsTools()) {
            LOG.debug("Model {} does not support tools; dropping {} tool specs", model.id(), opts.tools().size());
        }
        LOG.debug("Building request: model={}, region={}, maxTokens={}, tools={}, reasoningBudget={}",
                model.id(), routing.region(), maxTokens, tools.size(), reasoningBudget);

        GenerationRequest request = new GenerationRequest(
                model.id(),
                routing.region(),
                VoiceDeliveryGuidelines.appendTo(props.getSystemPrompt()),
                messages(context, utterance),
                maxTokens,
                temperature,
                tools,
                reasoningBudget);
        return RequestBuildResult.success(request);
    }

    /**
     * Prior turns mapped to chat roles, then the current utterance. Consecutive turns by the same
     * speaker are merged so roles alternate; empty turns are skipped.
     */
    static List<GenerationMessage> messages(ConversationContext context, String utterance) {
        List<GenerationMessage> messages = new ArrayList<>();
        if (context != null) {
            for (ConversationTurn turn : context.turns()) {
                String role = turn.role() == SpeakerRole.AGENT ? GenerationMessage.ASSISTANT : GenerationMessage.USER;
                append(messages, role, turn.text());
            }
        }
        append(messages, GenerationMessage.USER, utterance == null ? "" : utterance);
        if (messages.isEmpty()) {
            messages.add(GenerationMessage.user(""));
        }
        return messages;
    }

    private static void append(List<GenerationMessage> messages, String role, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        int last = messages.size() - 1;
        if (last >= 0 && messages.get(last).role().equals(role)) {
            GenerationMessage previous = messages.get(last);
            messages.set(last, new GenerationMessage(role, previous.content() + "\n" + text));
        } else {
            messages.add(new GenerationMessage(role, text));
        }
    }
}
