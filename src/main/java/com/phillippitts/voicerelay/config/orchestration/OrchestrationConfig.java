package com.phillippitts.voicerelay.config.orchestration;

import com.phillippitts.voicerelay.config.properties.SynthesisProperties;
import com.phillippitts.voicerelay.service.generation.TurnRequestBuilder;
import com.phillippitts.voicerelay.service.metrics.TelemetryPublisher;
import com.phillippitts.voicerelay.service.orchestration.CallSessionRegistry;
import com.phillippitts.voicerelay.service.orchestration.TurnPipeline;
import com.phillippitts.voicerelay.service.orchestration.VoiceTurnOrchestrator;
import com.phillippitts.voicerelay.service.resilience.ResilientGenerationInvoker;
import com.phillippitts.voicerelay.service.resilience.ResilientSynthesis;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import com.phillippitts.voicerelay.service.routing.ModelRegionSelector;
import com.phillippitts.voicerelay.service.scoring.ComplexityScorer;
import com.phillippitts.voicerelay.service.synthesis.SynthesisDispatcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the VoiceTurnOrchestrator explicitly, grouping the turn stages in a {@link TurnPipeline}.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public TurnPipeline turnPipeline(ComplexityScorer scorer,
                                     ModelRegionSelector selector,
                                     TurnRequestBuilder requestBuilder,
                                     ResilientGenerationInvoker invoker,
                                     SynthesisDispatcher dispatcher,
                                     ResilientSynthesis synthesis) {
        return new TurnPipeline(scorer, selector, requestBuilder, invoker, dispatcher, synthesis);
    }

    // CHECKSTYLE.OFF: ParameterNumber
    @Bean
    public VoiceTurnOrchestrator voiceTurnOrchestrator(TurnPipeline pipeline,
                                                       CallSessionRegistry sessions,
                                                       @Qualifier("turnExecutor") Executor turnExecutor,
                                                       @Qualifier("streamExecutor") Executor streamExecutor,
                                                       SynthesisProperties synthesisProperties,
                                                       ModelCatalog catalog,
                                                       ApplicationEventPublisher publisher,
                                                       TelemetryPublisher telemetry,
                                                       Clock clock) {
        return new VoiceTurnOrchestrator(pipeline, sessions, turnExecutor, streamExecutor, synthesisProperties,
                catalog, publisher, telemetry, clock, System::nanoTime);
    }
    // CHECKSTYLE.ON: ParameterNumber
}
