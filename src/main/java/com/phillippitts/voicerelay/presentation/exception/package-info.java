/**
 * REST boundary error mapping.
 *
 * <p>{@code GlobalExceptionHandler} maps invalid requests to 400, unavailable services and open
 * circuits to 503, and anything else to 500 with a generic body.
 */
package com.phillippitts.voicerelay.presentation.exception;
