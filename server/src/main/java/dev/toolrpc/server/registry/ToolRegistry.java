package dev.toolrpc.server.registry;

import dev.toolrpc.protocol.ToolDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools known to the server, keyed by name. Assembled once through {@link Builder} at startup and
 * immutable afterwards, so lookups need no locking.
 */
public final class ToolRegistry {

    private final Map<String, RegisteredTool> tools;
    private final List<ToolDescriptor> descriptors;

    private ToolRegistry(Map<String, RegisteredTool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        this.descriptors = tools.values().stream().map(RegisteredTool::descriptor).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Snapshot of all tool descriptors in registration order.
     * @return immutable descriptor list
     */
    public List<ToolDescriptor> listTools() {
        return descriptors;
    }

    public Optional<RegisteredTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public static final class Builder {

        private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();

        /**
         * Register a tool.
         * @param descriptor public metadata of the tool
         * @param executor execution function
         * @return this builder
         * @throws DuplicateToolNameException if a tool with the same name is already registered
         */
        public Builder register(ToolDescriptor descriptor, ToolExecutor executor) {
            RegisteredTool tool = new RegisteredTool(descriptor, executor);
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new DuplicateToolNameException(tool.name());
            }
            return this;
        }

        public Builder register(ToolProvider provider) {
            return register(provider.descriptor(), provider);
        }

        public Builder registerAll(Iterable<? extends ToolProvider> providers) {
            for (ToolProvider provider : providers) {
                register(provider);
            }
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(tools);
        }
    }
}
