package com.phillippitts.voicerelay.service.routing;

import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.ModelTier;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of model profiles plus the degradation chain, loaded once at startup.
 *
 * <p>Immutable and safe to share across calls.
 */
public final class ModelCatalog {

    private final Map<String, ModelProfile> profiles;
    private final List<String> degradationChain;

    public ModelCatalog(Collection<ModelProfile> profiles, List<String> degradationChain) {
        Map<String, ModelProfile> byId = new LinkedHashMap<>();
        for (ModelProfile p : profiles) {
            if (byId.putIfAbsent(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate model id in catalog: " + p.id());
            }
        }
        this.profiles = Collections.unmodifiableMap(byId);
        this.degradationChain = List.copyOf(degradationChain);
    }

    public Optional<ModelProfile> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(profiles.get(modelId));
    }

    public boolean contains(String modelId) {
        return modelId != null && profiles.containsKey(modelId);
    }

    public Collection<ModelProfile> all() {
        return profiles.values();
    }

    public List<ModelProfile> byTier(ModelTier tier) {
        return profiles.values().stream().filter(p -> p.tier() == tier).toList();
    }

    /** Model ids in fallback order, most capable first. */
    public List<String> degradationChain() {
        return degradationChain;
    }
}
