package com.phillippitts.voicerelay.config.properties;

import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.ModelTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model catalog, region availability and degradation chain, bound from {@code voicerelay.routing.*}.
 *
 * <p>Example:
 * <pre>
 * voicerelay.routing.models[0].id=claude-3-haiku
 * voicerelay.routing.models[0].tier=FAST
 * voicerelay.routing.availability[claude-3-haiku]=us-east-1,us-west-2
 * voicerelay.routing.degradation-chain=claude-opus-4,claude-sonnet-4,claude-3-haiku
 * </pre>
 *
 * <p>Cross-field consistency is checked at startup by
 * {@code RoutingConfigurationValidator}.
 */
@ConfigurationProperties(prefix = "voicerelay.routing")
@Validated
public class RoutingProperties {

    @Valid
    @NotEmpty(message = "At least one model must be configured under voicerelay.routing.models")
    private List<ModelProperties> models = new ArrayList<>();

    /** Regions serving each model, keyed by model id. */
    private Map<String, List<String>> availability = new LinkedHashMap<>();

    /** Regions probed, in order, when a model is unavailable in the preferred region. */
    private List<String> fallbackRegions = new ArrayList<>();

    @NotBlank
    private String defaultRegion = "us-east-1";

    /** Reasoning budget requested by the high-complexity rule before clamping. */
    @PositiveOrZero
    private int defaultReasoningBudget = 4096;

    /** Static fallback order walked by the resilience layer, most capable first. */
    @NotEmpty(message = "voicerelay.routing.degradation-chain must list at least one model")
    private List<String> degradationChain = new ArrayList<>();

    public List<ModelProperties> getModels() {
        return models;
    }

    public void setModels(List<ModelProperties> models) {
        this.models = models;
    }

    public Map<String, List<String>> getAvailability() {
        return availability;
    }

    public void setAvailability(Map<String, List<String>> availability) {
        this.availability = availability;
    }

    public List<String> getFallbackRegions() {
        return fallbackRegions;
    }

    public void setFallbackRegions(List<String> fallbackRegions) {
        this.fallbackRegions = fallbackRegions;
    }

    public String getDefaultRegion() {
        return defaultRegion;
    }

    public void setDefaultRegion(String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    public int getDefaultReasoningBudget() {
        return defaultReasoningBudget;
    }

    public void setDefaultReasoningBudget(int defaultReasoningBudget) {
        this.defaultReasoningBudget = defaultReasoningBudget;
    }

    public List<String> getDegradationChain() {
        return degradationChain;
    }

    public void setDegradationChain(List<String> degradationChain) {
        this.degradationChain = degradationChain;
    }

    /**
     * One catalog entry.
     */
    public static class ModelProperties {
        @NotBlank(message = "Model id must not be blank")
        private String id;
        @NotNull
        private ModelTier tier = ModelTier.MID;
        private int intelligenceRank;
        private int speedRank;
        private int costRank;
        @Positive
        private int maxOutputTokens = 4096;
        private boolean supportsTools;
        private boolean supportsExtendedReasoning;
        private boolean supportsVision;
        @PositiveOrZero
        private int maxReasoningBudget;
        @PositiveOrZero
        private double inputPricePerMillion;
        @PositiveOrZero
        private double outputPricePerMillion;

        public ModelProfile toProfile() {
            return new ModelProfile(id, tier, intelligenceRank, speedRank, costRank, maxOutputTokens,
                    supportsTools, supportsExtendedReasoning, supportsVision,
                    supportsExtendedReasoning ? maxReasoningBudget : 0,
                    inputPricePerMillion, outputPricePerMillion);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public ModelTier getTier() {
            return tier;
        }

        public void setTier(ModelTier tier) {
            this.tier = tier;
        }

        public int getIntelligenceRank() {
            return intelligenceRank;
        }

        public void setIntelligenceRank(int intelligenceRank) {
            this.intelligenceRank = intelligenceRank;
        }

        public int getSpeedRank() {
            return speedRank;
        }

        public void setSpeedRank(int speedRank) {
            this.speedRank = speedRank;
        }

        public int getCostRank() {
            return costRank;
        }

        public void setCostRank(int costRank) {
            this.costRank = costRank;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public boolean isSupportsTools() {
            return supportsTools;
        }

        public void setSupportsTools(boolean supportsTools) {
            this.supportsTools = supportsTools;
        }

        public boolean isSupportsExtendedReasoning() {
            return supportsExtendedReasoning;
        }

        public void setSupportsExtendedReasoning(boolean supportsExtendedReasoning) {
            this.supportsExtendedReasoning = supportsExtendedReasoning;
        }

        public boolean isSupportsVision() {
            return supportsVision;
        }

        public void setSupportsVision(boolean supportsVision) {
            this.supportsVision = supportsVision;
        }

        public int getMaxReasoningBudget() {
            return maxReasoningBudget;
        }

        public void setMaxReasoningBudget(int maxReasoningBudget) {
            this.maxReasoningBudget = maxReasoningBudget;
        }

        public double getInputPricePerMillion() {
            return inputPricePerMillion;
        }

        public void setInputPricePerMillion(double inputPricePerMillion) {
            this.inputPricePerMillion = inputPricePerMillion;
        }

        public double getOutputPricePerMillion() {
            return outputPricePerMillion;
        }

        public void setOutputPricePerMillion(double outputPricePerMillion) {
            this.outputPricePerMillion = outputPricePerMillion;
        }
    }
}
