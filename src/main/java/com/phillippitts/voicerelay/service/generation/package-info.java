/**
 * Generation requests and streams.
 *
 * <p>{@link com.phillippitts.voicerelay.service.generation.TurnRequestBuilder} builds the request
 * for a routed turn; {@link com.phillippitts.voicerelay.service.generation.GenerationClient}
 * opens a {@link com.phillippitts.voicerelay.service.generation.GenerationStream} of typed
 * deltas. Resilience is layered on top in {@code service.resilience}.
 */
package com.phillippitts.voicerelay.service.generation;
