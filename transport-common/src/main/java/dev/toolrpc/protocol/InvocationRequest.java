package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Params of {@code tools/call}.
 * @param toolName name of the tool to invoke, {@code name} on the wire
 * @param arguments argument object, validated against the tool's input schema
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationRequest(@JsonProperty("name") String toolName, JsonNode arguments) {
}
