package com.phillippitts.voicerelay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Generation service connection and request defaults, bound from {@code voicerelay.generation.*}.
 */
@ConfigurationProperties(prefix = "voicerelay.generation")
@Validated
public class GenerationProperties {

    /** Streaming endpoint. May contain a {@code {region}} placeholder. */
    @NotBlank(message = "voicerelay.generation.endpoint must be set")
    private String endpoint = "https://api.anthropic.com/v1/messages";

    private String apiKey = "";

    @NotBlank
    private String apiVersion = "2023-06-01";

    @Positive
    private long connectTimeoutMs = 2_000;

    /** Time allowed until response headers arrive. */
    @Positive
    private long requestTimeoutMs = 10_000;

    @Positive
    private int defaultMaxTokens = 300;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double temperature = 0.3;

    /** Agent prompt; voice-delivery guidelines are appended to it. */
    private String systemPrompt = "You are a helpful phone agent.";

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getDefaultMaxTokens() {
        return defaultMaxTokens;
    }

    public void setDefaultMaxTokens(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
