/**
 * Turn orchestration and call sessions.
 *
 * <p>{@link com.phillippitts.voicerelay.service.orchestration.VoiceTurnOrchestrator} runs each
 * turn through scoring, routing, generation, segmentation and synthesis.
 * {@link com.phillippitts.voicerelay.service.orchestration.CallSessionRegistry} owns the live
 * calls, their conversation context and hangup.
 */
package com.phillippitts.voicerelay.service.orchestration;
