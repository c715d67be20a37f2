package com.phillippitts.voicerelay.service.synthesis.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.exception.RateLimitedException;
import com.phillippitts.voicerelay.exception.RequestInvalidException;
import com.phillippitts.voicerelay.exception.ServiceTimeoutException;
import com.phillippitts.voicerelay.exception.ServiceUnavailableException;
import com.phillippitts.voicerelay.service.synthesis.VoiceSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class SpeakApiSynthesisClientTest {

    private static final VoiceSettings VOICE = new VoiceSettings("aura-asteria-en", "mulaw", 8000);
    private static final byte[] AUDIO = {0x7f, 0x7e, 0x7d, 0x7c};

    private SynthesisProperties props;
    private SpeakApiSynthesisClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wiremock) {
        props = new SynthesisProperties();
        props.setBaseUrl(wiremock.getHttpBaseUrl() + "/");
        props.setApiKey("dg-key");
        props.setRequestTimeoutMs(500);
        client = new SpeakApiSynthesisClient(props, new ObjectMapper());
    }

    @Test
    void shouldReturnAudioBytes() {
        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(200).withBody(AUDIO)));

        byte[] audio = client.synthesize("Your table is ready.", VOICE);

        assertThat(audio).isEqualTo(AUDIO);
        verify(postRequestedFor(urlPathEqualTo("/v1/speak"))
                .withQueryParam("model", equalTo("aura-asteria-en"))
                .withQueryParam("encoding", equalTo("mulaw"))
                .withQueryParam("sample_rate", equalTo("8000"))
                .withHeader("Authorization", equalTo("Token dg-key"))
                .withRequestBody(equalToJson("{\"text\":\"Your table is ready.\"}")));
    }

    @Test
    void shouldRejectBlankTextWithoutCalling() {
        assertThatThrownBy(() -> client.synthesize("  ", VOICE))
                .isInstanceOf(RequestInvalidException.class)
                .hasMessageContaining("synthesis:aura-asteria-en");
    }

    @Test
    void shouldMapStatusCodesToFailureKinds() {
        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(429)));
        assertThatThrownBy(() -> client.synthesize("Hi.", VOICE)).isInstanceOf(RateLimitedException.class);

        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(503)));
        assertThatThrownBy(() -> client.synthesize("Hi.", VOICE)).isInstanceOf(ServiceUnavailableException.class);

        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(422)));
        assertThatThrownBy(() -> client.synthesize("Hi.", VOICE)).isInstanceOf(RequestInvalidException.class);
    }

    @Test
    void shouldTreatEmptyAudioAsUnavailable() {
        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(200)));

        assertThatThrownBy(() -> client.synthesize("Hi.", VOICE))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("no audio");
    }

    @Test
    void shouldMapSlowResponseToTimeout() {
        stubFor(post(urlPathEqualTo("/v1/speak")).willReturn(aResponse().withStatus(200).withBody(AUDIO)
                .withFixedDelay(2_000)));

        assertThatThrownBy(() -> client.synthesize("Hi.", VOICE)).isInstanceOf(ServiceTimeoutException.class);
    }

    @Test
    void shouldEncodeVoiceParametersInUri() {
        VoiceSettings voice = new VoiceSettings("aura en", "linear16", 16000);

        assertThat(client.speakUri(voice).toString())
                .endsWith("/v1/speak?model=aura+en&encoding=linear16&sample_rate=16000")
                .doesNotContain("//v1");
    }
}
