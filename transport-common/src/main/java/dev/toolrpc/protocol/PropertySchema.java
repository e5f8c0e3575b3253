package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Schema of a single tool input property.
 * @param type expected JSON type, {@code null} when unconstrained
 * @param description human-readable description shown to the caller
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PropertySchema(JsonType type, String description) {
}
