package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Name and version of a client or server implementation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Implementation(String name, String version) {
}
