package dev.toolrpc.client.adapter;

import dev.toolrpc.protocol.JsonType;

/**
 * One argument of a remote tool, derived from its input schema.
 * @param name argument name
 * @param type expected JSON type, {@code null} when the schema leaves it open
 * @param required whether the argument must be supplied
 * @param description human-readable description
 */
public record ToolParameter(String name, JsonType type, boolean required, String description) {

    String signature() {
        String typeName = type == null ? "any" : type.schemaName();
        return name + (required ? "" : "?") + ": " + typeName;
    }
}
