package dev.toolrpc.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.toolrpc.client.session.ClientSession;
import dev.toolrpc.client.session.ProtocolException;
import dev.toolrpc.client.transport.TransportException;
import dev.toolrpc.protocol.InputSchema;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.ToolDescriptor;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A discovered tool exposed as a local operation. Invoking it sends {@code tools/call} through the
 * owning session.
 */
public final class RemoteTool {

    private final String server;
    private final ToolDescriptor descriptor;
    private final List<ToolParameter> parameters;
    private final ClientSession session;
    private final ObjectMapper mapper;

    RemoteTool(String server, ToolDescriptor descriptor, ClientSession session, ObjectMapper mapper) {
        this.server = server;
        this.descriptor = descriptor;
        this.session = session;
        this.mapper = mapper;
        this.parameters = toParameters(descriptor.inputSchema());
    }

    private static List<ToolParameter> toParameters(InputSchema schema) {
        return schema.properties().entrySet().stream()
            .map(entry -> new ToolParameter(entry.getKey(), entry.getValue().type(),
                schema.required().contains(entry.getKey()), entry.getValue().description()))
            .toList();
    }

    /**
     * @return name of the server offering this tool
     */
    public String server() {
        return server;
    }

    public String name() {
        return descriptor.name();
    }

    public String description() {
        return descriptor.description();
    }

    public ToolDescriptor descriptor() {
        return descriptor;
    }

    public List<ToolParameter> parameters() {
        return parameters;
    }

    /**
     * Compact signature such as {@code add(a: integer, b: integer)}, optional arguments marked
     * with {@code ?}.
     * @return signature text
     */
    public String signature() {
        return parameters.stream().map(ToolParameter::signature)
            .collect(Collectors.joining(", ", name() + "(", ")"));
    }

    public InvocationResult invoke(Map<String, ?> arguments) throws TransportException, ProtocolException {
        JsonNode tree = mapper.valueToTree(arguments == null ? Map.of() : arguments);
        return invoke(tree);
    }

    public InvocationResult invoke(JsonNode arguments) throws TransportException, ProtocolException {
        return session.callTool(name(), arguments);
    }

    @Override
    public String toString() {
        return signature();
    }
}
