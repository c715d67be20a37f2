package com.phillippitts.voicerelay.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Tool the model may call, described by a JSON schema for its input.
 *
 * @param name        tool name
 * @param description what the tool does
 * @param inputSchema JSON schema of the tool input, as nested maps
 */
public record ToolSpec(String name, String description, Map<String, Object> inputSchema) {

    public ToolSpec {
        Objects.requireNonNull(name, "tool name must not be null");
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of("type", "object") : Map.copyOf(inputSchema);
    }
}
