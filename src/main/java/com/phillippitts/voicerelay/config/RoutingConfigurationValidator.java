package com.phillippitts.voicerelay.config;

import com.phillippitts.voicerelay.config.properties.RoutingProperties;
import com.phillippitts.voicerelay.domain.ModelTier;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the model catalog, availability table and degradation chain at startup to fail fast
 * with actionable messages.
 */
@Component
class RoutingConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(RoutingConfigurationValidator.class);

    private final RoutingProperties props;

    RoutingConfigurationValidator(RoutingProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        Set<String> ids = new HashSet<>();
        for (RoutingProperties.ModelProperties model : props.getModels()) {
            if (!ids.add(model.getId())) {
                throw new IllegalArgumentException("Duplicate voicerelay.routing.models id: '" + model.getId() + "'");
            }
        }
        for (String chained : props.getDegradationChain()) {
            if (!ids.contains(chained)) {
                throw new IllegalArgumentException("voicerelay.routing.degradation-chain references unknown model '"
                        + chained + "'. Known models: " + ids);
            }
        }
        for (String model : props.getAvailability().keySet()) {
            if (!ids.contains(model)) {
                throw new IllegalArgumentException("voicerelay.routing.availability references unknown model '"
                        + model + "'. Known models: " + ids);
            }
        }
        for (String id : ids) {
            List<String> regions = props.getAvailability().getOrDefault(id, List.of());
            if (regions.isEmpty()) {
                throw new IllegalArgumentException("Model '" + id + "' has no region. Add voicerelay.routing.availability["
                        + id + "]=<region>[,<region>...]");
            }
        }
        requireTier(ModelTier.FAST);
        requireTier(ModelTier.MID);

        for (RoutingProperties.ModelProperties model : props.getModels()) {
            if (model.isSupportsExtendedReasoning() && model.getMaxReasoningBudget() == 0) {
                LOG.warn("Model {} supports extended reasoning but max-reasoning-budget is 0; "
                        + "reasoning will never be requested", model.getId());
            }
        }
        Map<String, List<String>> availability = props.getAvailability();
        if (!props.getFallbackRegions().isEmpty() && availability.values().stream()
                .flatMap(List::stream).noneMatch(props.getFallbackRegions()::contains)) {
            LOG.warn("No model is served from any fallback region {}", props.getFallbackRegions());
        }
    }

    private void requireTier(ModelTier tier) {
        boolean present = props.getModels().stream().anyMatch(m -> m.getTier() == tier);
        if (!present) {
            throw new IllegalArgumentException("voicerelay.routing.models must contain at least one " + tier
                    + " tier model");
        }
    }
}
