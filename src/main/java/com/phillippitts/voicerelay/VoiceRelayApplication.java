package com.phillippitts.voicerelay;

import com.phillippitts.voicerelay.config.properties.GenerationProperties;
import com.phillippitts.voicerelay.config.properties.ResilienceProperties;
import com.phillippitts.voicerelay.config.properties.RoutingProperties;
import com.phillippitts.voicerelay.config.properties.ScoringProperties;
import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ScoringProperties.class,
        RoutingProperties.class,
        ResilienceProperties.class,
        GenerationProperties.class,
        SynthesisProperties.class
})
@EnableScheduling
public class VoiceRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceRelayApplication.class, args);
    }

}
