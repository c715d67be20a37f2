package com.phillippitts.voicerelay.service.orchestration;

import com.phillippitts.voicerelay.service.generation.TurnRequestBuilder;
import com.phillippitts.voicerelay.service.resilience.ResilientGenerationInvoker;
import com.phillippitts.voicerelay.service.resilience.ResilientSynthesis;
import com.phillippitts.voicerelay.service.routing.ModelRegionSelector;
import com.phillippitts.voicerelay.service.scoring.ComplexityScorer;
import com.phillippitts.voicerelay.service.synthesis.SynthesisDispatcher;

import java.util.Objects;

/**
 * The stages a turn passes through, grouped for cleaner constructor injection.
 */
public record TurnPipeline(
        ComplexityScorer scorer,
        ModelRegionSelector selector,
        TurnRequestBuilder requestBuilder,
        ResilientGenerationInvoker invoker,
        SynthesisDispatcher dispatcher,
        ResilientSynthesis synthesis
) {

    public TurnPipeline {
        Objects.requireNonNull(scorer, "scorer");
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(requestBuilder, "requestBuilder");
        Objects.requireNonNull(invoker, "invoker");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(synthesis, "synthesis");
    }
}
