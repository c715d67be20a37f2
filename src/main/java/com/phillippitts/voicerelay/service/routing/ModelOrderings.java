package com.phillippitts.voicerelay.service.routing;

import com.phillippitts.voicerelay.domain.ModelProfile;

import java.util.Comparator;

/**
 * Deterministic orderings over model profiles. Each ends with the model id so no two
 * distinct profiles compare equal.
 */
final class ModelOrderings {

    private static final Comparator<ModelProfile> BY_ID = Comparator.comparing(ModelProfile::id);

    /** Most capable first. */
    static final Comparator<ModelProfile> MOST_CAPABLE = Comparator
            .comparingInt(ModelProfile::intelligenceRank).reversed()
            .thenComparing(Comparator.comparingInt(ModelProfile::speedRank).reversed())
            .thenComparing(BY_ID);

    /** Fastest first, then cheapest. */
    static final Comparator<ModelProfile> FASTEST_THEN_CHEAPEST = Comparator
            .comparingInt(ModelProfile::speedRank).reversed()
            .thenComparingInt(ModelProfile::costRank)
            .thenComparing(BY_ID);

    /** Fastest first, then most capable. */
    static final Comparator<ModelProfile> FASTEST_THEN_MOST_CAPABLE = Comparator
            .comparingInt(ModelProfile::speedRank).reversed()
            .thenComparing(Comparator.comparingInt(ModelProfile::intelligenceRank).reversed())
            .thenComparing(BY_ID);

    /** Cheapest first, then fastest. */
    static final Comparator<ModelProfile> CHEAPEST_THEN_FASTEST = Comparator
            .comparingInt(ModelProfile::costRank)
            .thenComparing(Comparator.comparingInt(ModelProfile::speedRank).reversed())
            .thenComparing(BY_ID);

    private ModelOrderings() {
    }
}
