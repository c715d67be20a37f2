package com.phillippitts.voicerelay.service.generation.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.domain.TokenUsage;
import com.phillippitts.voicerelay.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.exception.SegmentationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates Messages API server-sent events into {@link TextDelta}s.
 *
 * <p>Handled event types:
 * <ul>
 *   <li>{@code message_start} - records input token usage</li>
 *   <li>{@code content_block_delta} with a {@code text_delta} - CONTENT</li>
 *   <li>{@code message_delta} - records output token usage</li>
 *   <li>{@code message_stop} - END with usage</li>
 *   <li>{@code error} - ERROR with the mapped failure</li>
 * </ul>
 * Everything else ({@code ping}, block start/stop, thinking and tool-input deltas) yields nothing.
 *
 * <p>One instance per stream; not thread-safe.
 */
final class MessagesStreamParser {

    private static final Logger LOG = LogManager.getLogger(MessagesStreamParser.class);

    private final ObjectMapper mapper;
    private final String target;
    private long inputTokens;
    private long outputTokens;

    MessagesStreamParser(ObjectMapper mapper, String target) {
        this.mapper = mapper;
        this.target = target;
    }

    /**
     * Handles one dispatched SSE event.
     *
     * @param eventName value of the {@code event:} field (nullable)
     * @param data      concatenated {@code data:} lines
     * @return delta to emit, or null when the event carries nothing for the caller
     */
    TextDelta onEvent(String eventName, String data) {
        JsonNode root;
        try {
            root = mapper.readTree(data);
        } catch (JsonProcessingException e) {
            return TextDelta.error(new SegmentationException("Malformed generation stream event: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return TextDelta.error(new SegmentationException("Generation stream event is not a JSON object"));
        }
        String type = root.path("type").asText(eventName == null ? "" : eventName);
        switch (type) {
            case "message_start" -> {
                JsonNode usage = root.path("message").path("usage");
                inputTokens = usage.path("input_tokens").asLong(inputTokens);
                outputTokens = usage.path("output_tokens").asLong(outputTokens);
                return null;
            }
            case "content_block_delta" -> {
                JsonNode delta = root.path("delta");
                if ("text_delta".equals(delta.path("type").asText())) {
                    JsonNode text = delta.get("text");
                    if (text == null || !text.isTextual()) {
                        return TextDelta.error(new SegmentationException("text_delta without text"));
                    }
                    return TextDelta.content(text.asText());
                }
                return null;
            }
            case "message_delta" -> {
                outputTokens = root.path("usage").path("output_tokens").asLong(outputTokens);
                return null;
            }
            case "message_stop" -> {
                return TextDelta.end(new TokenUsage(inputTokens, outputTokens));
            }
            case "error" -> {
                JsonNode error = root.path("error");
                String errorType = error.path("type").asText("unknown");
                String message = error.path("message").asText("Generation stream error");
                return TextDelta.error(ExternalServiceExceptionBuilder.create(message)
                        .target(target)
                        .metadata("errorType", errorType)
                        .build(kindForErrorType(errorType)));
            }
            default -> {
                LOG.trace("Ignoring generation stream event type={}", type);
                return null;
            }
        }
    }

    /** Called when the body ends without {@code message_stop}. */
    TextDelta onEndOfInput() {
        return TextDelta.error(ExternalServiceExceptionBuilder.create("Generation stream ended before message_stop")
                .target(target)
                .build(FailureKind.SERVICE_UNAVAILABLE));
    }

    /**
     * Maps a Messages API {@code error.type} to a failure kind.
     */
    static FailureKind kindForErrorType(String errorType) {
        if (errorType == null) {
            return FailureKind.TRANSIENT;
        }
        return switch (errorType) {
            case "rate_limit_error" -> FailureKind.RATE_LIMITED;
            case "overloaded_error", "api_error" -> FailureKind.SERVICE_UNAVAILABLE;
            case "invalid_request_error", "not_found_error", "request_too_large",
                    "authentication_error", "permission_error" -> FailureKind.REQUEST_INVALID;
            case "timeout_error" -> FailureKind.TIMEOUT;
            default -> FailureKind.TRANSIENT;
        };
    }
}
