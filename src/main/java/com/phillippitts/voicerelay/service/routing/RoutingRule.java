package com.phillippitts.voicerelay.service.routing;

import com.phillippitts.voicerelay.domain.ModelProfile;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * One entry of the ordered routing table: when {@code condition} holds, {@code chooser} picks a
 * model from the catalog.
 *
 * @param name      rule name, reported on the decision and in metrics
 * @param condition predicate over the routing inputs
 * @param chooser   picks a model, or empty when the catalog has no candidate for this rule
 * @param reasoning whether the rule grants a reasoning budget
 */
public record RoutingRule(
        String name,
        Predicate<RoutingRequest> condition,
        BiFunction<RoutingRequest, ModelCatalog, Optional<ModelProfile>> chooser,
        boolean reasoning
) {

    public boolean matches(RoutingRequest request) {
        return condition.test(request);
    }

    public Optional<ModelProfile> choose(RoutingRequest request, ModelCatalog catalog) {
        return chooser.apply(request, catalog);
    }
}
