package com.phillippitts.voicerelay.service.generation;

import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.domain.ConversationTurn;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.ModelTier;
import com.phillippitts.voicerelay.domain.RequestBuildResult;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.domain.ToolSpec;
import com.phillippitts.voicerelay.domain.TurnOptions;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.testutil.RoutingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.voicerelay.testutil.RoutingFixtures.HAIKU;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.SONNET;
import static com.phillippitts.voicerelay.testutil.RoutingFixtures.US_EAST;
import static org.assertj.core.api.Assertions.assertThat;

class TurnRequestBuilderTest {

    private static final ToolSpec LOOKUP = new ToolSpec("lookup_appointment", "Finds an appointment",
            Map.of("type", "object"));

    private GenerationProperties props;
    private TurnRequestBuilder builder;

    @BeforeEach
    void setUp() {
        props = new GenerationProperties();
        props.setSystemPrompt("You book dental appointments.");
        builder = new TurnRequestBuilder(RoutingFixtures.catalog(), props);
    }

    @Test
    void shouldApplyDefaultsForPlainTurn() {
        GenerationRequest request = build("Hi there", ConversationContext.empty(), route(HAIKU, 0),
                TurnOptions.withLatencyBudget(150));

        assertThat(request.modelId()).isEqualTo(HAIKU);
        assertThat(request.region()).isEqualTo(US_EAST);
        assertThat(request.maxTokens()).isEqualTo(300);
        assertThat(request.temperature()).isEqualTo(0.3);
        assertThat(request.reasoningBudget()).isZero();
        assertThat(request.messages()).containsExactly(GenerationMessage.user("Hi there"));
    }

    @Test
    void shouldAppendVoiceGuidelinesToAgentPrompt() {
        GenerationRequest request = build("Hi", null, route(HAIKU, 0), null);

        assertThat(request.systemPrompt()).startsWith("You book dental appointments.");
        assertThat(request.systemPrompt()).endsWith(VoiceDeliveryGuidelines.TEXT);
        assertThat(request.systemPrompt()).contains("closing question");
    }

    @Test
    void shouldCapMaxTokensAtModelCeiling() {
        TurnOptions options = new TurnOptions(500, false, List.of(), 10_000, null);

        GenerationRequest request = build("Hi", null, route(HAIKU, 0), options);

        assertThat(request.maxTokens()).isEqualTo(4096);
    }

    @Test
    void shouldHonorRequestedTemperature() {
        TurnOptions options = new TurnOptions(500, false, List.of(), 0, 0.9);

        assertThat(build("Hi", null, route(HAIKU, 0), options).temperature()).isEqualTo(0.9);
    }

    @Test
    void shouldAttachReasoningBudgetForReasoningModel() {
        GenerationRequest request = build("Hi", null, route(SONNET, 4096), null);

        assertThat(request.reasoningBudget()).isEqualTo(4096);
        assertThat(request.maxTokens()).isEqualTo(300 + 4096);
    }

    @Test
    void shouldClampReasoningBudgetToModelMaximum() {
        GenerationRequest request = build("Hi", null, route(SONNET, 50_000), null);

        assertThat(request.reasoningBudget()).isEqualTo(32_000);
    }

    @Test
    void shouldNotAttachReasoningBudgetWhenModelLacksSupport() {
        GenerationRequest request = build("Hi", null, route(HAIKU, 4096), null);

        assertThat(request.reasoningBudget()).isZero();
        assertThat(request.hasReasoningBudget()).isFalse();
    }

    @Test
    void shouldAttachToolsOnlyWhenModelSupportsThem() {
        ModelCatalog catalog = new ModelCatalog(List.of(
                new ModelProfile("no-tools", ModelTier.FAST, 1, 4, 1, 1024, false, false, false, 0, 0, 0),
                new ModelProfile("with-tools", ModelTier.MID, 2, 2, 2, 1024, true, false, false, 0, 0, 0)),
                List.of("with-tools", "no-tools"));
        TurnRequestBuilder toolBuilder = new TurnRequestBuilder(catalog, props);
        TurnOptions options = new TurnOptions(500, false, List.of(LOOKUP), 0, null);

        GenerationRequest without = toolBuilder.build("Hi", null, route("no-tools", 0), options).request();
        GenerationRequest with = toolBuilder.build("Hi", null, route("with-tools", 0), options).request();

        assertThat(without.tools()).isEmpty();
        assertThat(with.tools()).containsExactly(LOOKUP);
    }

    @Test
    void shouldReturnFailureForModelMissingFromCatalog() {
        RequestBuildResult result = builder.build("Hi", null, route("retired-model", 0), null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isInstanceOf(RequestInvalidException.class);
        assertThat(((RequestInvalidException) result.error()).getTarget()).isEqualTo("retired-model");
    }

    @Test
    void shouldMapHistoryToAlternatingRoles() {
        ConversationContext context = ConversationContext.empty()
                .append(ConversationTurn.caller("I need to move my cleaning."))
                .append(ConversationTurn.agent("Sure, to which day?"))
                .append(ConversationTurn.caller("Friday."));

        List<GenerationMessage> messages = TurnRequestBuilder.messages(context, "Morning if possible.");

        assertThat(messages).containsExactly(
                GenerationMessage.user("I need to move my cleaning."),
                GenerationMessage.assistant("Sure, to which day?"),
                GenerationMessage.user("Friday.\nMorning if possible."));
    }

    private GenerationRequest build(String utterance, ConversationContext context, RoutingDecision routing,
                                    TurnOptions options) {
        RequestBuildResult result = builder.build(utterance, context, routing, options);
        assertThat(result.isSuccess()).isTrue();
        return result.request();
    }

    private static RoutingDecision route(String modelId, int reasoningBudget) {
        return new RoutingDecision(modelId, US_EAST, reasoningBudget, "test", false, false);
    }
}
