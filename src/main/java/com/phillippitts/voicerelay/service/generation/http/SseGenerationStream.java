package com.phillippitts.voicerelay.service.generation.http;

import com.phillippitts.voicerelay.domain.TextDelta;
import com.phillippitts.voicerelay.exception.CallCancelledException;
import com.phillippitts.voicerelay.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.voicerelay.service.generation.GenerationStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * {@link GenerationStream} over a server-sent-events response body.
 *
 * <p>Frames lines into events ({@code event:}/{@code data:} fields, blank-line dispatch,
 * {@code :} comments) and hands each event to a {@link MessagesStreamParser}.
 */
final class SseGenerationStream implements GenerationStream {

    private static final Logger LOG = LogManager.getLogger(SseGenerationStream.class);

    private final InputStream body;
    private final BufferedReader reader;
    private final MessagesStreamParser parser;
    private final String target;
    private volatile boolean closed;
    private boolean terminated;

    SseGenerationStream(InputStream body, MessagesStreamParser parser, String target) {
        this.body = body;
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.parser = parser;
        this.target = target;
    }

    @Override
    public TextDelta next() {
        if (terminated) {
            throw new IllegalStateException("Generation stream already terminated");
        }
        TextDelta delta = readNext();
        if (delta.type() != TextDelta.Type.CONTENT) {
            terminated = true;
            close();
        }
        return delta;
    }

    private TextDelta readNext() {
        String eventName = null;
        StringBuilder data = new StringBuilder();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() > 0) {
                        TextDelta delta = parser.onEvent(eventName, data.toString());
                        eventName = null;
                        data.setLength(0);
                        if (delta != null) {
                            return delta;
                        }
                    }
                } else if (line.startsWith("event:")) {
                    eventName = line.substring("event:".length()).trim();
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(line.substring("data:".length()).stripLeading());
                }
                // ':' comments and unknown fields are ignored
            }
            // an event cut off by EOF without its blank line is still dispatched
            if (data.length() > 0) {
                TextDelta delta = parser.onEvent(eventName, data.toString());
                if (delta != null) {
                    return delta;
                }
            }
            return parser.onEndOfInput();
        } catch (IOException e) {
            if (closed) {
                return TextDelta.error(new CallCancelledException("Generation stream closed", e));
            }
            return TextDelta.error(ExternalServiceExceptionBuilder.create("Generation stream read failed")
                    .target(target)
                    .cause(e)
                    .build());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            body.close();
        } catch (IOException e) {
            LOG.debug("Error closing generation stream body: {}", e.toString());
        }
    }
}
