package com.phillippitts.voicerelay.service.generation.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.domain.TokenUsage;
import com.phillippitts.voicerelay.domain.ToolSpec;
import com.phillippitts.voicerelay.exception.RateLimitedException;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.exception.ServiceTimeoutException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class MessagesApiGenerationClientTest {

    private static final String PATH = "/us-east-1/v1/messages";

    private static final String SSE_BODY = """
            event: message_start
            data: {"type":"message_start","message":{"usage":{"input_tokens":25,"output_tokens":1}}}

            event: content_block_start
            data: {"type":"content_block_start","index":0,"content_block":{"type":"text","text":""}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Your appointment"}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":" is confirmed."}}

            event: message_delta
            data: {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":12}}

            event: message_stop
            data: {"type":"message_stop"}

            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private GenerationProperties props;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wiremock) {
        props = new GenerationProperties();
        props.setEndpoint(wiremock.getHttpBaseUrl() + "/{region}/v1/messages");
        props.setApiKey("test-key");
        props.setRequestTimeoutMs(2_000);
    }

    @Test
    void shouldStreamDeltasFromRegionalEndpoint() {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/event-stream")
                .withBody(SSE_BODY)));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        try (GenerationStream stream = client.open(request(0))) {
            assertThat(stream.next()).isEqualTo(TextDelta.content("Your appointment"));
            assertThat(stream.next()).isEqualTo(TextDelta.content(" is confirmed."));
            TextDelta end = stream.next();
            assertThat(end.type()).isEqualTo(TextDelta.Type.END);
            assertThat(end.usage()).isEqualTo(new TokenUsage(25, 12));
        }

        verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("x-api-key", equalTo("test-key"))
                .withHeader("anthropic-version", equalTo("2023-06-01"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("claude-3-haiku")))
                .withRequestBody(matchingJsonPath("$.stream", equalTo("true"))));
    }

    @Test
    void shouldMapTooManyRequestsToRateLimited() {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(429)
                .withBody("{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"slow\"}}")));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        assertThatThrownBy(() -> client.open(request(0)))
                .isInstanceOf(RateLimitedException.class)
                .hasMessageContaining("status=429")
                .hasMessageContaining("errorType=rate_limit_error");
    }

    @Test
    void shouldMapOverloadedToServiceUnavailable() {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(529)));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        assertThatThrownBy(() -> client.open(request(0))).isInstanceOf(ServiceUnavailableException.class);
    }

    @Test
    void shouldMapBadRequestToRequestInvalid() {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(400)
                .withBody("{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\"}}")));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        assertThatThrownBy(() -> client.open(request(0)))
                .isInstanceOf(RequestInvalidException.class)
                .satisfies(e -> assertThat(((RequestInvalidException) e).getTarget()).isEqualTo("claude-3-haiku"));
    }

    @Test
    void shouldMapSlowResponseToTimeout() {
        props.setRequestTimeoutMs(200);
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(200).withFixedDelay(2_000)));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        assertThatThrownBy(() -> client.open(request(0))).isInstanceOf(ServiceTimeoutException.class);
    }

    @Test
    void shouldReportStreamErrorEventAsErrorDelta() {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(200)
                .withBody("""
                        event: content_block_delta
                        data: {"type":"content_block_delta","delta":{"type":"text_delta","text":"One moment."}}

                        event: error
                        data: {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}

                        """)));
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        try (GenerationStream stream = client.open(request(0))) {
            assertThat(stream.next().type()).isEqualTo(TextDelta.Type.CONTENT);
            TextDelta error = stream.next();
            assertThat(error.type()).isEqualTo(TextDelta.Type.ERROR);
            assertThat(error.error()).isInstanceOf(ServiceUnavailableException.class);
        }
    }

    @Test
    void shouldSerializeThinkingInsteadOfTemperatureWhenReasoning() throws Exception {
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);

        JsonNode json = mapper.readTree(client.toJson(request(2048)));

        assertThat(json.path("thinking").path("type").asText()).isEqualTo("enabled");
        assertThat(json.path("thinking").path("budget_tokens").asInt()).isEqualTo(2048);
        assertThat(json.has("temperature")).isFalse();
    }

    @Test
    void shouldSerializeMessagesToolsAndTemperature() throws Exception {
        MessagesApiGenerationClient client = new MessagesApiGenerationClient(props, mapper);
        GenerationRequest request = new GenerationRequest("claude-sonnet-4", "us-east-1", "Be brief.",
                List.of(GenerationMessage.user("Book me in")), 300, 0.3,
                List.of(new ToolSpec("book", "Books a slot", Map.of("type", "object"))), 0);

        JsonNode json = mapper.readTree(client.toJson(request));

        assertThat(json.path("system").asText()).isEqualTo("Be brief.");
        assertThat(json.path("temperature").asDouble()).isEqualTo(0.3);
        assertThat(json.path("messages").get(0).path("role").asText()).isEqualTo("user");
        assertThat(json.path("tools").get(0).path("name").asText()).isEqualTo("book");
        assertThat(json.path("tools").get(0).path("input_schema").path("type").asText()).isEqualTo("object");
    }

    private static GenerationRequest request(int reasoningBudget) {
        return new GenerationRequest("claude-3-haiku", "us-east-1", "You are a phone agent.",
                List.of(GenerationMessage.user("Can you confirm my appointment?")), 300, 0.3, List.of(),
                reasoningBudget);
    }
}
