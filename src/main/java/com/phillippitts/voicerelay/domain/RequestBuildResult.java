package com.phillippitts.voicerelay.domain;

import java.util.Objects;

/**
 * Outcome of building a generation request: either a request or the reason it could not be built.
 */
public record RequestBuildResult(GenerationRequest request, RuntimeException error) {

    public RequestBuildResult {
        if ((request == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of request or error must be set");
        }
    }

    public static RequestBuildResult success(GenerationRequest request) {
        return new RequestBuildResult(Objects.requireNonNull(request, "request"), null);
    }

    public static RequestBuildResult failure(RuntimeException error) {
        return new RequestBuildResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return request != null;
    }
}
