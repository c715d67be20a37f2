/**
 * Utterance complexity scoring.
 *
 * <p>{@link com.phillippitts.voicerelay.service.scoring.ComplexityScorer} turns caller text and
 * conversation context into a {@link com.phillippitts.voicerelay.domain.ComplexityScore} that
 * drives model selection.
 */
package com.phillippitts.voicerelay.service.scoring;
