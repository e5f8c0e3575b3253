package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of {@code initialize}: the negotiated protocol version and the server capabilities.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InitializeResult(String protocolVersion, JsonNode capabilities, Implementation serverInfo) {
}
