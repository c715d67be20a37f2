/**
 * Micrometer instrumentation of turns, routing and resilience.
 */
package com.phillippitts.voicerelay.service.metrics;
