package dev.toolrpc.server.registry;

import dev.toolrpc.protocol.ToolDescriptor;
import java.util.Objects;

public record RegisteredTool(ToolDescriptor descriptor, ToolExecutor executor) {

    public RegisteredTool {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(executor, "executor");
    }

    public String name() {
        return descriptor.name();
    }
}
