package com.phillippitts.voicerelay.config;

import com.phillippitts.voicerelay.config.properties.RoutingProperties;
import com.phillippitts.voicerelay.domain.ModelTier;
import com.phillippitts.voicerelay.testutil.RoutingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingConfigurationValidatorTest {

    private RoutingProperties props;

    @BeforeEach
    void setUp() {
        props = RoutingFixtures.routingProperties();
        props.setModels(new ArrayList<>(props.getModels()));
        props.setAvailability(new LinkedHashMap<>(props.getAvailability()));
    }

    @Test
    void shouldAcceptShippedCatalog() {
        assertThatCode(() -> new RoutingConfigurationValidator(props).validate()).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectDuplicateModelIds() {
        props.getModels().add(props.getModels().get(0));

        assertThatThrownBy(() -> new RoutingConfigurationValidator(props).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate")
                .hasMessageContaining(RoutingFixtures.HAIKU);
    }

    @Test
    void shouldRejectUnknownModelInChain() {
        props.setDegradationChain(List.of(RoutingFixtures.SONNET, "claude-2"));

        assertThatThrownBy(() -> new RoutingConfigurationValidator(props).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("degradation-chain")
                .hasMessageContaining("claude-2");
    }

    @Test
    void shouldRejectUnknownModelInAvailability() {
        props.getAvailability().put("claude-2", List.of(RoutingFixtures.US_EAST));

        assertThatThrownBy(() -> new RoutingConfigurationValidator(props).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("availability");
    }

    @Test
    void shouldRejectModelWithoutRegion() {
        Map<String, List<String>> availability = props.getAvailability();
        availability.remove(RoutingFixtures.OPUS);

        assertThatThrownBy(() -> new RoutingConfigurationValidator(props).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RoutingFixtures.OPUS)
                .hasMessageContaining("no region");
    }

    @Test
    void shouldRequireMidTier() {
        props.getModels().removeIf(m -> m.getTier() == ModelTier.MID);
        props.getAvailability().remove(RoutingFixtures.SONNET);
        props.setDegradationChain(List.of(RoutingFixtures.OPUS, RoutingFixtures.HAIKU));

        assertThatThrownBy(() -> new RoutingConfigurationValidator(props).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MID");
    }
}
