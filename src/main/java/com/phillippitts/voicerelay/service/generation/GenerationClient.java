package com.phillippitts.voicerelay.service.generation;

import com.phillippitts.voicerelay.domain.GenerationRequest;
import com.phillippitts.voicerelay.exception.ExternalServiceException;

/**
 * Streaming access to the generation service.
 */
public interface GenerationClient {

    /**
     * Opens a generation stream.
     *
     * @param request request to send (model and region already chosen)
     * @return open stream
     * @throws ExternalServiceException if the stream cannot be opened; the subclass encodes the
     *         failure kind (rate limited, unavailable, timeout, invalid request)
     */
    GenerationStream open(GenerationRequest request);
}
