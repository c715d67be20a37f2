package com.phillippitts.voicerelay.service.synthesis.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.service.synthesis.SynthesisClient;
import com.phillippitts.voicerelay.service.synthesis.VoiceSettings;
import com.phillippitts.voicerelay.util.Latency;
import com.phillippitts.voicerelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SynthesisClient} for a speak-style HTTP API: the text is posted as JSON and the response
 * body is the audio.
 *
 * <p>Status codes map to the same failure taxonomy as generation calls.
 */
@Component
public class SpeakApiSynthesisClient implements SynthesisClient {

    private static final Logger LOG = LogManager.getLogger(SpeakApiSynthesisClient.class);

    private final SynthesisProperties props;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public SpeakApiSynthesisClient(SynthesisProperties props, ObjectMapper mapper) {
        this.props = Objects.requireNonNull(props, "props");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public byte[] synthesize(String text, VoiceSettings voice) {
        String target = voice.breakerTarget();
        if (text == null || text.isBlank()) {
            throw new RequestInvalidException("Synthesis text must not be blank", target);
        }
        long startNanos = System.nanoTime();
        HttpRequest.Builder builder = HttpRequest.newBuilder(speakUri(voice))
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body(text, target), StandardCharsets.UTF_8));
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.header("Authorization", "Token " + props.getApiKey().trim());
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw ExternalServiceExceptionBuilder.create("Synthesis request timed out")
                    .target(target)
                    .durationMs(Latency.millisSince(startNanos))
                    .cause(e)
                    .build(FailureKind.TIMEOUT);
        } catch (IOException e) {
            throw ExternalServiceExceptionBuilder.create("Synthesis request failed")
                    .target(target)
                    .durationMs(Latency.millisSince(startNanos))
                    .cause(e)
                    .build(FailureKind.SERVICE_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Synthesis request interrupted", e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            LOG.warn("Synthesis rejected: voice={}, status={}, text='{}'",
                    voice.voice(), status, LogSanitizer.preview(text));
            throw ExternalServiceExceptionBuilder.create("Synthesis request rejected")
                    .target(target)
                    .httpStatus(status)
                    .durationMs(Latency.millisSince(startNanos))
                    .build();
        }
        byte[] audio = response.body();
        if (audio == null || audio.length == 0) {
            throw ExternalServiceExceptionBuilder.create("Synthesis returned no audio")
                    .target(target)
                    .httpStatus(status)
                    .build(FailureKind.SERVICE_UNAVAILABLE);
        }
        LOG.debug("Synthesized {} bytes in {} ms", audio.length, Latency.millisSince(startNanos));
        return audio;
    }

    URI speakUri(VoiceSettings voice) {
        String base = props.getBaseUrl().endsWith("/")
                ? props.getBaseUrl().substring(0, props.getBaseUrl().length() - 1)
                : props.getBaseUrl();
        return URI.create(base + "/v1/speak?model=" + encode(voice.voice())
                + "&encoding=" + encode(voice.encoding())
                + "&sample_rate=" + voice.sampleRate());
    }

    private String body(String text, String target) {
        try {
            return mapper.writeValueAsString(Map.of("text", text));
        } catch (JsonProcessingException e) {
            throw new RequestInvalidException("Synthesis request could not be serialized", target, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
