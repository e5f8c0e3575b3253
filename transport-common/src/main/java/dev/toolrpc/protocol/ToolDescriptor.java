package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Public metadata of a tool, as returned by {@code tools/list}.
 * @param name unique tool name
 * @param description human-readable description used to choose between tools
 * @param inputSchema schema the call arguments are validated against
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDescriptor(String name, String description, InputSchema inputSchema) {

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
    }
}
