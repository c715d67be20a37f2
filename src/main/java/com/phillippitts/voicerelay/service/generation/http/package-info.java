/**
 * HTTP adapter for the streaming generation service (server-sent events).
 */
package com.phillippitts.voicerelay.service.generation.http;
