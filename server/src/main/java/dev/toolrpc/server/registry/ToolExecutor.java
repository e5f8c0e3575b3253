package dev.toolrpc.server.registry;

import com.fasterxml.jackson.databind.JsonNode;
import dev.toolrpc.protocol.InvocationResult;

/**
 * Execution function of a tool. Receives arguments that already passed schema validation.
 * Implementations that keep mutable state synchronize it themselves; executions of different
 * calls may run concurrently.
 */
@FunctionalInterface
public interface ToolExecutor {
    InvocationResult execute(JsonNode arguments) throws Exception;
}
