package com.phillippitts.voicerelay.service.generation.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.domain.GenerationMessage;
import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.ToolSpec;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.service.generation.GenerationClient;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import com.phillippitts.voicerelay.util.Latency;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link GenerationClient} for a Messages-style streaming HTTP API.
 *
 * <p>The endpoint may contain a {@code {region}} placeholder, replaced by the routed region.
 * Non-2xx responses are mapped to the failure taxonomy by status code:
 * 429 rate limited; 500, 502, 503 and 529 unavailable; 408 and 504 timeout;
 * 400, 404, 413 and 422 invalid request.
 */
@Component
public class MessagesApiGenerationClient implements GenerationClient {

    private static final Logger LOG = LogManager.getLogger(MessagesApiGenerationClient.class);

    /** Maximum error body read for diagnostics. */
    private static final int MAX_ERROR_BODY_BYTES = 4096;

    private final GenerationProperties props;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public MessagesApiGenerationClient(GenerationProperties props, ObjectMapper mapper) {
        this.props = Objects.requireNonNull(props, "props");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public GenerationStream open(GenerationRequest request) {
        long startNanos = System.nanoTime();
        URI uri = URI.create(props.getEndpoint().replace("{region}", request.region()));
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("anthropic-version", props.getApiVersion())
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request), StandardCharsets.UTF_8));
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.header("x-api-key", props.getApiKey().trim());
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw ExternalServiceExceptionBuilder.create("Generation request timed out")
                    .target(request.modelId())
                    .durationMs(Latency.millisSince(startNanos))
                    .metadata("region", request.region())
                    .cause(e)
                    .build(FailureKind.TIMEOUT);
        } catch (IOException e) {
            throw ExternalServiceExceptionBuilder.create("Generation request failed")
                    .target(request.modelId())
                    .durationMs(Latency.millisSince(startNanos))
                    .metadata("region", request.region())
                    .cause(e)
                    .build(FailureKind.SERVICE_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Generation request interrupted", e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            String errorType = readErrorType(response.body());
            LOG.warn("Generation request rejected: model={}, region={}, status={}, errorType={}",
                    request.modelId(), request.region(), status, errorType);
            throw ExternalServiceExceptionBuilder.create("Generation request rejected")
                    .target(request.modelId())
                    .httpStatus(status)
                    .durationMs(Latency.millisSince(startNanos))
                    .metadata("region", request.region())
                    .metadata("errorType", errorType)
                    .build();
        }
        LOG.debug("Generation stream opened: model={}, region={}, headersMs={}",
                request.modelId(), request.region(), Latency.millisSince(startNanos));
        return new SseGenerationStream(response.body(), new MessagesStreamParser(mapper, request.modelId()),
                request.modelId());
    }

    String toJson(GenerationRequest request) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", request.modelId());
        root.put("max_tokens", request.maxTokens());
        root.put("stream", true);
        if (!request.systemPrompt().isEmpty()) {
            root.put("system", request.systemPrompt());
        }
        ArrayNode messages = root.putArray("messages");
        for (GenerationMessage message : request.messages()) {
            messages.addObject().put("role", message.role()).put("content", message.content());
        }
        if (request.hasTools()) {
            ArrayNode tools = root.putArray("tools");
            for (ToolSpec tool : request.tools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.name());
                node.put("description", tool.description());
                node.set("input_schema", mapper.valueToTree(tool.inputSchema()));
            }
        }
        if (request.hasReasoningBudget()) {
            // temperature must stay at its default when thinking is enabled
            root.putObject("thinking")
                    .put("type", "enabled")
                    .put("budget_tokens", request.reasoningBudget());
        } else {
            root.put("temperature", request.temperature());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new RequestInvalidException("Generation request could not be serialized", request.modelId(), e);
        }
    }

    private String readErrorType(InputStream body) {
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY_BYTES);
            if (bytes.length == 0) {
                return "none";
            }
            JsonNode root = mapper.readTree(bytes);
            return root.path("error").path("type").asText("unknown");
        } catch (IOException e) {
            LOG.debug("Could not read generation error body: {}", e.toString());
            return "unreadable";
        }
    }
}
