package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Result of {@code tools/list}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListToolsResult(List<ToolDescriptor> tools) {

    public ListToolsResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
