package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.exception.FailureKind;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.service.routing.RegionAvailability;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses the next model and region to try after a generation failure.
 *
 * <p>Per failure kind:
 * <ul>
 *   <li>SERVICE_UNAVAILABLE: the same model in its next untried region, else the next model</li>
 *   <li>TIMEOUT: the next model in the chain that is faster than the failed one</li>
 *   <li>RATE_LIMITED, CIRCUIT_OPEN, TRANSIENT: the next model in the chain</li>
 *   <li>REQUEST_INVALID: nothing</li>
 * </ul>
 * Models are only proposed in a region that serves them; an attempted model/region pair is
 * never proposed twice.
 */
@Component
public class FallbackChain {

    /**
     * Next attempt.
     *
     * @param modelId        model to try
     * @param region         region to try
     * @param regionFallback true when the region is not the caller's preferred region
     */
    public record Candidate(String modelId, String region, boolean regionFallback) {
    }

    private final ModelCatalog catalog;
    private final RegionAvailability availability;

    public FallbackChain(ModelCatalog catalog, RegionAvailability availability) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.availability = Objects.requireNonNull(availability, "availability");
    }

    /**
     * Key identifying one model/region attempt.
     */
    public static String attemptKey(String modelId, String region) {
        return modelId + "@" + region;
    }

    /**
     * @param failedModel     model of the failed attempt
     * @param failedRegion    region of the failed attempt
     * @param kind            how it failed
     * @param preferredRegion caller's preferred region
     * @param attempted       keys from {@link #attemptKey(String, String)} already tried
     * @return next candidate, empty when the chain is exhausted for this failure
     */
    public Optional<Candidate> next(String failedModel, String failedRegion, FailureKind kind,
                                    String preferredRegion, Set<String> attempted) {
        if (kind == FailureKind.REQUEST_INVALID) {
            return Optional.empty();
        }
        String preferred = preferredRegion == null || preferredRegion.isBlank()
                ? availability.defaultRegion() : preferredRegion;
        if (kind == FailureKind.SERVICE_UNAVAILABLE) {
            Optional<Candidate> sameModel = untriedRegion(failedModel, preferred, attempted);
            if (sameModel.isPresent()) {
                return sameModel;
            }
        }
        Optional<ModelProfile> failed = catalog.find(failedModel);
        for (String modelId : downstreamOf(failedModel, failed)) {
            if (modelId.equals(failedModel)) {
                continue;
            }
            Optional<ModelProfile> profile = catalog.find(modelId);
            if (profile.isEmpty()) {
                continue;
            }
            if (kind == FailureKind.TIMEOUT && failed.isPresent()
                    && profile.get().speedRank() <= failed.get().speedRank()) {
                continue;
            }
            Optional<Candidate> candidate = untriedRegion(modelId, preferred, attempted);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    /**
     * Chain entries after the failed model. A model outside the chain degrades to the chain
     * entries that are no more capable than it.
     */
    private List<String> downstreamOf(String failedModel, Optional<ModelProfile> failed) {
        List<String> chain = catalog.degradationChain();
        int index = chain.indexOf(failedModel);
        if (index >= 0) {
            return chain.subList(index + 1, chain.size());
        }
        if (failed.isEmpty()) {
            return chain;
        }
        int rank = failed.get().intelligenceRank();
        return chain.stream()
                .filter(id -> catalog.find(id).map(p -> p.intelligenceRank() <= rank).orElse(false))
                .toList();
    }

    private Optional<Candidate> untriedRegion(String modelId, String preferred, Set<String> attempted) {
        for (String region : availability.candidateRegions(modelId, preferred)) {
            if (!attempted.contains(attemptKey(modelId, region))) {
                return Optional.of(new Candidate(modelId, region, !region.equals(preferred)));
            }
        }
        return Optional.empty();
    }
}
