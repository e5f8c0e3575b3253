package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural description of a tool's arguments: an object with typed properties, a required
 * subset and an optional ban on undeclared properties.
 * @param type always {@code object}
 * @param properties declared properties in declaration order
 * @param required names of properties that must be present
 * @param additionalProperties {@code false} to reject undeclared properties, {@code null} or
 * {@code true} to accept them
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InputSchema(
    String type,
    Map<String, PropertySchema> properties,
    List<String> required,
    Boolean additionalProperties
) {

    public InputSchema {
        type = type == null ? "object" : type;
        if (!"object".equals(type)) {
            throw new IllegalArgumentException("Tool input schema must be of type object: " + type);
        }
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
        for (String name : required) {
            if (!properties.containsKey(name)) {
                throw new IllegalArgumentException("Required property is not declared: " + name);
            }
        }
    }

    public static InputSchema empty() {
        return new InputSchema("object", Map.of(), List.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, PropertySchema> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();
        private Boolean additionalProperties;

        public Builder property(String name, JsonType type, String description) {
            properties.put(name, new PropertySchema(type, description));
            return this;
        }

        public Builder required(String name, JsonType type, String description) {
            property(name, type, description);
            required.add(name);
            return this;
        }

        public Builder additionalProperties(boolean allowed) {
            this.additionalProperties = allowed;
            return this;
        }

        public InputSchema build() {
            return new InputSchema("object", properties, required, additionalProperties);
        }
    }
}
