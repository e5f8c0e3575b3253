package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * JSON value types a tool property may declare.
 */
public enum JsonType {

    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array");

    private final String schemaName;

    JsonType(String schemaName) {
        this.schemaName = schemaName;
    }

    @JsonValue
    public String schemaName() {
        return schemaName;
    }

    /**
     * Resolve a schema type name. Unknown names resolve to {@code null}, which leaves the
     * property unconstrained.
     * @param name type name as it appears in a schema
     * @return the matching type or {@code null}
     */
    @JsonCreator
    public static JsonType fromSchemaName(String name) {
        for (JsonType type : values()) {
            if (type.schemaName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
