/**
 * Speech synthesis of streamed segments and ordered playback.
 *
 * <p>{@link com.phillippitts.voicerelay.service.synthesis.SynthesisDispatcher} consumes a turn's
 * segment channel, runs bounded concurrent synthesis calls and releases audio to the
 * {@link com.phillippitts.voicerelay.service.synthesis.AudioSink} strictly in sequence order.
 * The HTTP adapter lives in {@code service.synthesis.http}.
 */
package com.phillippitts.voicerelay.service.synthesis;
