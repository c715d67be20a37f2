/**
 * HTTP surface of the service: diagnostics controllers and error mapping.
 */
package com.phillippitts.voicerelay.presentation;
