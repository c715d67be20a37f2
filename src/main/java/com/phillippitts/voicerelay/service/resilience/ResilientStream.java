package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.domain.RoutingDecision;
import com.phillippitts.voicerelay.service.generation.GenerationStream;

/**
 * An opened generation stream and the route that served it.
 *
 * @param stream   stream positioned at its first delta
 * @param request  request that was sent
 * @param served   model and region that accepted the request
 * @param degraded true when a fallback model or region is serving the turn
 * @param attempts attempts made, including the successful one
 */
public record ResilientStream(
        GenerationStream stream,
        GenerationRequest request,
        RoutingDecision served,
        boolean degraded,
        int attempts
) {
}
