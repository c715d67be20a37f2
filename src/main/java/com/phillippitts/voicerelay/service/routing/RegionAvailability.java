package com.phillippitts.voicerelay.service.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static table of which regions serve which models, with the ordered fallback-region list.
 */
public final class RegionAvailability {

    /**
     * Region chosen for a model.
     *
     * @param region   serving region, or the preferred region when {@code degraded}
     * @param fallback true when a non-preferred region was chosen
     * @param degraded true when no known region serves the model
     */
    public record Resolution(String region, boolean fallback, boolean degraded) {
    }

    private final Map<String, Set<String>> regionsByModel;
    private final List<String> fallbackRegions;
    private final String defaultRegion;

    public RegionAvailability(Map<String, ? extends Collection<String>> regionsByModel,
                              List<String> fallbackRegions,
                              String defaultRegion) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        regionsByModel.forEach((model, regions) ->
                copy.put(model, Collections.unmodifiableSet(new LinkedHashSet<>(regions))));
        this.regionsByModel = Collections.unmodifiableMap(copy);
        this.fallbackRegions = List.copyOf(fallbackRegions);
        this.defaultRegion = Objects.requireNonNull(defaultRegion, "defaultRegion");
    }

    public boolean isAvailable(String modelId, String region) {
        return regionsByModel.getOrDefault(modelId, Set.of()).contains(region);
    }

    public Set<String> regionsFor(String modelId) {
        return regionsByModel.getOrDefault(modelId, Set.of());
    }

    public Set<String> modelIds() {
        return regionsByModel.keySet();
    }

    public String defaultRegion() {
        return defaultRegion;
    }

    public List<String> fallbackRegions() {
        return fallbackRegions;
    }

    /**
     * Picks the preferred region when it serves the model, else the first fallback region that does.
     *
     * @param modelId         model to place
     * @param preferredRegion caller's region (null uses the default region)
     * @return resolution; {@code degraded} when no region serves the model
     */
    public Resolution resolve(String modelId, String preferredRegion) {
        String preferred = preferredRegion == null || preferredRegion.isBlank() ? defaultRegion : preferredRegion;
        if (isAvailable(modelId, preferred)) {
            return new Resolution(preferred, false, false);
        }
        for (String candidate : fallbackRegions) {
            if (!candidate.equals(preferred) && isAvailable(modelId, candidate)) {
                return new Resolution(candidate, true, false);
            }
        }
        return new Resolution(preferred, false, true);
    }

    /**
     * Candidate regions for a model in probe order: the preferred region, then the fallback
     * regions, keeping only regions that serve the model.
     */
    public List<String> candidateRegions(String modelId, String preferredRegion) {
        String preferred = preferredRegion == null || preferredRegion.isBlank() ? defaultRegion : preferredRegion;
        List<String> ordered = new ArrayList<>();
        if (isAvailable(modelId, preferred)) {
            ordered.add(preferred);
        }
        for (String candidate : fallbackRegions) {
            if (!ordered.contains(candidate) && isAvailable(modelId, candidate)) {
                ordered.add(candidate);
            }
        }
        return List.copyOf(ordered);
    }
}
