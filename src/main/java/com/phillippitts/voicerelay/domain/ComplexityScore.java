package com.phillippitts.voicerelay.domain;

/**
 * Reasoning difficulty of one caller utterance.
 *
 * @param value         combined score in [0.0, 1.0]
 * @param wordFactor    length factor in [0.0, 1.0] (unweighted)
 * @param patternFactor share of complexity patterns matched, in [0.0, 1.0] (unweighted)
 * @param contextFactor context contribution added to the weighted sum
 */
public record ComplexityScore(double value, double wordFactor, double patternFactor, double contextFactor) {

    public static final ComplexityScore ZERO = new ComplexityScore(0.0, 0.0, 0.0, 0.0);

    public ComplexityScore {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Complexity must be between 0.0 and 1.0, got: " + value);
        }
    }

    public static ComplexityScore of(double value) {
        return new ComplexityScore(value, 0.0, 0.0, 0.0);
    }
}
