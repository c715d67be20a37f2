/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicerelay.exception.VoiceRelayException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicerelay.exception.ExternalServiceException} - A call to the
 *       generation or synthesis service failed; subclasses encode rate limiting, unavailability,
 *       timeouts, invalid requests and open circuits</li>
 *   <li>{@link com.phillippitts.voicerelay.exception.SegmentationException} - The generation
 *       stream delivered malformed data</li>
 *   <li>{@link com.phillippitts.voicerelay.exception.NoRouteAvailableException} - Every model
 *       in the degradation chain failed</li>
 *   <li>{@link com.phillippitts.voicerelay.exception.CallCancelledException} - The caller hung
 *       up while work was outstanding</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining, and map to HTTP status codes
 * via {@code GlobalExceptionHandler}. {@link com.phillippitts.voicerelay.exception.FailureKind}
 * classifies arbitrary throwables into the same taxonomy.
 *
 * @see com.phillippitts.voicerelay.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicerelay.exception;
