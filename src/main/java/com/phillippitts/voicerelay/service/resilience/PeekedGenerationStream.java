package com.phillippitts.voicerelay.service.resilience;

import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.service.generation.GenerationStream;

import java.util.function.Consumer;

/**
 * Replays the delta read while opening a stream, then delegates. Reports a mid-stream ERROR to
 * the breaker callback.
 */
final class PeekedGenerationStream implements GenerationStream {

    private final GenerationStream delegate;
    private final Consumer<Throwable> onStreamError;
    private TextDelta peeked;

    PeekedGenerationStream(TextDelta first, GenerationStream delegate, Consumer<Throwable> onStreamError) {
        this.peeked = first;
        this.delegate = delegate;
        this.onStreamError = onStreamError;
    }

    @Override
    public TextDelta next() {
        if (peeked != null) {
            TextDelta first = peeked;
            peeked = null;
            return first;
        }
        TextDelta delta = delegate.next();
        if (delta != null && delta.type() == TextDelta.Type.ERROR) {
            onStreamError.accept(delta.error());
        }
        return delta;
    }

    @Override
    public void close() {
        delegate.close();
    }
}
