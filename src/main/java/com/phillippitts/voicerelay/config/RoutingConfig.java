package com.phillippitts.voicerelay.config;

import com.phillippitts.voicerelay.config.properties.RoutingProperties;
import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.service.routing.RegionAvailability;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Builds the static routing tables from {@link RoutingProperties}.
 */
@Configuration
public class RoutingConfig {

    private static final Logger LOG = LogManager.getLogger(RoutingConfig.class);

    @Bean
    public ModelCatalog modelCatalog(RoutingProperties props) {
        List<ModelProfile> profiles = props.getModels().stream()
                .map(RoutingProperties.ModelProperties::toProfile)
                .toList();
        ModelCatalog catalog = new ModelCatalog(profiles, props.getDegradationChain());
        LOG.info("Model catalog loaded: models={}, degradationChain={}",
                profiles.stream().map(ModelProfile::id).toList(), catalog.degradationChain());
        return catalog;
    }

    @Bean
    public RegionAvailability regionAvailability(RoutingProperties props) {
        return new RegionAvailability(props.getAvailability(), props.getFallbackRegions(), props.getDefaultRegion());
    }

    /** Wall clock for circuit breaker timing. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
