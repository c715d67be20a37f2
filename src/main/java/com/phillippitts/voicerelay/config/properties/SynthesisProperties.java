package com.phillippitts.voicerelay.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Speech synthesis connection and dispatch settings, bound from {@code voicerelay.synthesis.*}.
 */
@ConfigurationProperties(prefix = "voicerelay.synthesis")
@Validated
public class SynthesisProperties {

    @NotBlank(message = "voicerelay.synthesis.base-url must be set")
    private String baseUrl = "https://api.deepgram.com";

    private String apiKey = "";

    @NotBlank
    private String voice = "aura-asteria-en";

    @NotBlank
    private String encoding = "mulaw";

    @Positive
    private int sampleRate = 8000;

    @Positive
    private long connectTimeoutMs = 2_000;

    @Positive
    private long requestTimeoutMs = 5_000;

    /** Outstanding synthesis calls allowed per turn. */
    @Min(value = 1, message = "Synthesis concurrency must be at least 1")
    @Max(value = 16, message = "Synthesis concurrency must be at most 16")
    private int maxConcurrency = 3;

    /** Segment events buffered between the stream consumer and the dispatcher. */
    @Positive
    private int channelCapacity = 8;

    /** Spoken instead of a terminal segment whose synthesis failed. */
    @NotBlank
    private String fallbackPhrase = "Is there anything else I can help you with?";

    /** Spoken when no answer could be generated. */
    @NotBlank
    private String apologyPhrase = "I'm sorry, I'm having trouble right now. Could you say that again?";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getVoice() {
        return voice;
    }

    public void setVoice(String voice) {
        this.voice = voice;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
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

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public void setChannelCapacity(int channelCapacity) {
        this.channelCapacity = channelCapacity;
    }

    public String getFallbackPhrase() {
        return fallbackPhrase;
    }

    public void setFallbackPhrase(String fallbackPhrase) {
        this.fallbackPhrase = fallbackPhrase;
    }

    public String getApologyPhrase() {
        return apologyPhrase;
    }

    public void setApologyPhrase(String apologyPhrase) {
        this.apologyPhrase = apologyPhrase;
    }
}
