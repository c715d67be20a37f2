/**
 * Streaming sentence segmentation.
 *
 * <p>{@link com.phillippitts.voicerelay.service.segment.SentenceSegmenter} turns generation
 * deltas into sequence-numbered segment events and publishes them on a bounded
 * {@link com.phillippitts.voicerelay.service.segment.SegmentChannel} read by the synthesis
 * dispatcher.
 */
package com.phillippitts.voicerelay.service.segment;
