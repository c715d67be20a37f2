package com.phillippitts.voicerelay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for utterance complexity scoring.
 *
 * <p>Properties are bound from {@code voicerelay.scoring.*}.
 */
@ConfigurationProperties(prefix = "voicerelay.scoring")
@Validated
public class ScoringProperties {

    /** How context signals combine into the context factor. */
    public enum ContextPolicy {
        /** Only the highest-priority matching signal contributes. */
        FIRST_MATCH,
        /** Every matching signal contributes. */
        ADDITIVE
    }

    /** Case-insensitive phrases that indicate multi-step reasoning. */
    @NotEmpty(message = "At least one complexity pattern is required")
    private List<String> patterns = new ArrayList<>(List.of(
            "analyze", "troubleshoot", "compare", "step by step", "explain why",
            "diagnose", "evaluate", "calculate", "pros and cons", "what if"));

    @NotNull
    private ContextPolicy contextPolicy = ContextPolicy.FIRST_MATCH;

    /** Word count at which the length factor saturates. */
    @Positive(message = "Word saturation must be positive")
    private int wordSaturation = 50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double wordWeight = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double patternWeight = 0.5;

    /** Prior-turn count above which a conversation counts as long. */
    @PositiveOrZero
    private int longHistoryTurns = 5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double longHistoryFactor = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double toolsFactor = 0.4;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double multiTurnFactor = 0.2;

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns;
    }

    public ContextPolicy getContextPolicy() {
        return contextPolicy;
    }

    public void setContextPolicy(ContextPolicy contextPolicy) {
        this.contextPolicy = contextPolicy;
    }

    public int getWordSaturation() {
        return wordSaturation;
    }

    public void setWordSaturation(int wordSaturation) {
        this.wordSaturation = wordSaturation;
    }

    public double getWordWeight() {
        return wordWeight;
    }

    public void setWordWeight(double wordWeight) {
        this.wordWeight = wordWeight;
    }

    public double getPatternWeight() {
        return patternWeight;
    }

    public void setPatternWeight(double patternWeight) {
        this.patternWeight = patternWeight;
    }

    public int getLongHistoryTurns() {
        return longHistoryTurns;
    }

    public void setLongHistoryTurns(int longHistoryTurns) {
        this.longHistoryTurns = longHistoryTurns;
    }

    public double getLongHistoryFactor() {
        return longHistoryFactor;
    }

    public void setLongHistoryFactor(double longHistoryFactor) {
        this.longHistoryFactor = longHistoryFactor;
    }

    public double getToolsFactor() {
        return toolsFactor;
    }

    public void setToolsFactor(double toolsFactor) {
        this.toolsFactor = toolsFactor;
    }

    public double getMultiTurnFactor() {
        return multiTurnFactor;
    }

    public void setMultiTurnFactor(double multiTurnFactor) {
        this.multiTurnFactor = multiTurnFactor;
    }
}
