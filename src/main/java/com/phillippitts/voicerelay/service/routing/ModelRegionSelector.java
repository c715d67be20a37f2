package com.phillippitts.voicerelay.service.routing;

import com.phillippitts.voicerelay.config.properties.RoutingProperties;
import com.phillippitts.voicerelay.domain.ComplexityScore;
import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.domain.ModelTier;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.exception.NoRouteAvailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps complexity, latency budget, cost preference and tool needs to a model and region.
 *
 * <p>Rules are evaluated top to bottom and the first rule that matches and finds a model wins:
 * <ol>
 *   <li>{@code high-reasoning}: score &gt; 0.9 and budget &gt; 1000ms, most capable model with a
 *       reasoning budget</li>
 *   <li>{@code fast-tight}: score &lt; 0.3 and budget &lt; 150ms, fastest FAST model, cheapest when
 *       cost-sensitive, else most capable</li>
 *   <li>{@code fast}: score &lt; 0.6 and budget &lt; 200ms, fastest then cheapest FAST model</li>
 *   <li>{@code tools}: tools needed, most capable tool-capable MID model</li>
 *   <li>{@code capable}: score &gt; 0.7, most capable MID model</li>
 *   <li>{@code balanced}: cheapest then fastest MID model</li>
 * </ol>
 *
 * <p>The selector holds no mutable state: identical inputs against the same catalog and
 * availability table always produce identical decisions.
 */
@Service
public class ModelRegionSelector {

    private static final Logger LOG = LogManager.getLogger(ModelRegionSelector.class);

    private final ModelCatalog catalog;
    private final RegionAvailability availability;
    private final int defaultReasoningBudget;
    private final List<RoutingRule> rules;

    public ModelRegionSelector(ModelCatalog catalog, RegionAvailability availability, RoutingProperties props) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.defaultReasoningBudget = props.getDefaultReasoningBudget();
        this.rules = defaultRules();
    }

    /**
     * Selects the model and region for one turn.
     *
     * @param score           complexity of the utterance
     * @param latencyBudgetMs time-to-first-token budget
     * @param costSensitive   prefer cheaper models where the rule allows
     * @param needsTools      the turn exposes tools to the model
     * @param preferredRegion caller's region (null uses the default region)
     * @return routing decision; {@code degraded} when no region serves the chosen model
     * @throws NoRouteAvailableException if no rule finds a model (the catalog is empty)
     */
    public RoutingDecision select(ComplexityScore score, long latencyBudgetMs, boolean costSensitive,
                                  boolean needsTools, String preferredRegion) {
        RoutingRequest request = new RoutingRequest(score, latencyBudgetMs, costSensitive, needsTools, preferredRegion);
        for (RoutingRule rule : rules) {
            if (!rule.matches(request)) {
                continue;
            }
            Optional<ModelProfile> chosen = rule.choose(request, catalog);
            if (chosen.isEmpty()) {
                LOG.debug("Routing rule {} matched but the catalog has no candidate", rule.name());
                continue;
            }
            return decide(rule, chosen.get(), preferredRegion);
        }
        throw new NoRouteAvailableException("No routing rule produced a model", List.of(), null);
    }

    public RoutingDecision select(RoutingRequest request) {
        return select(request.score(), request.latencyBudgetMs(), request.costSensitive(),
                request.needsTools(), request.preferredRegion());
    }

    /** Rule names in evaluation order. */
    public List<String> ruleNames() {
        return rules.stream().map(RoutingRule::name).toList();
    }

    private RoutingDecision decide(RoutingRule rule, ModelProfile model, String preferredRegion) {
        int budget = rule.reasoning() && model.supportsExtendedReasoning()
                ? Math.min(defaultReasoningBudget, model.maxReasoningBudget())
                : 0;
        RegionAvailability.Resolution resolution = availability.resolve(model.id(), preferredRegion);
        if (resolution.degraded()) {
            LOG.warn("Model {} is not available in any configured region; routing degraded", model.id());
        }
        return new RoutingDecision(model.id(), resolution.region(), budget, rule.name(),
                resolution.fallback(), resolution.degraded());
    }

    private static List<RoutingRule> defaultRules() {
        return List.of(
                new RoutingRule("high-reasoning",
                        r -> r.complexity() > 0.9 && r.latencyBudgetMs() > 1000,
                        (r, c) -> c.all().stream().min(ModelOrderings.MOST_CAPABLE),
                        true),
                new RoutingRule("fast-tight",
                        r -> r.complexity() < 0.3 && r.latencyBudgetMs() < 150,
                        (r, c) -> c.byTier(ModelTier.FAST).stream().min(r.costSensitive()
                                ? ModelOrderings.FASTEST_THEN_CHEAPEST
                                : ModelOrderings.FASTEST_THEN_MOST_CAPABLE),
                        false),
                new RoutingRule("fast",
                        r -> r.complexity() < 0.6 && r.latencyBudgetMs() < 200,
                        (r, c) -> c.byTier(ModelTier.FAST).stream().min(ModelOrderings.FASTEST_THEN_CHEAPEST),
                        false),
                new RoutingRule("tools",
                        RoutingRequest::needsTools,
                        (r, c) -> c.byTier(ModelTier.MID).stream()
                                .filter(ModelProfile::supportsTools)
                                .min(ModelOrderings.MOST_CAPABLE)
                                .or(() -> c.all().stream()
                                        .filter(ModelProfile::supportsTools)
                                        .min(ModelOrderings.MOST_CAPABLE)),
                        false),
                new RoutingRule("capable",
                        r -> r.complexity() > 0.7,
                        (r, c) -> c.byTier(ModelTier.MID).stream().min(ModelOrderings.MOST_CAPABLE),
                        false),
                new RoutingRule("balanced",
                        r -> true,
                        (r, c) -> c.byTier(ModelTier.MID).stream().min(ModelOrderings.CHEAPEST_THEN_FASTEST)
                                .or(() -> c.all().stream().min(ModelOrderings.CHEAPEST_THEN_FASTEST)),
                        false)
        );
    }
}
