package dev.toolrpc.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.toolrpc.client.session.ClientSession;
import dev.toolrpc.client.session.ProtocolException;
import dev.toolrpc.client.transport.TransportException;
import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.ProtocolError;
import dev.toolrpc.protocol.SessionException;
import dev.toolrpc.protocol.SessionState;
import dev.toolrpc.protocol.ToolDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boundary consumed by an upstream reasoning component: enumerate the tools of one or more named
 * servers as a single catalog with enough metadata to choose among them, and invoke one by name
 * with structured arguments. Performs no reasoning of its own.
 */
public class ToolAdapter implements AutoCloseable {

    public static final String DEFAULT_SERVER = "default";

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolAdapter.class);

    private final ObjectMapper mapper;
    private final Map<String, ClientSession> servers = new LinkedHashMap<>();

    private volatile Map<String, RemoteTool> operations = Map.of();

    public ToolAdapter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ToolAdapter(ClientSession session, ObjectMapper mapper) {
        this(mapper);
        addServer(DEFAULT_SERVER, session);
    }

    /**
     * Add a server whose tools join the catalog on the next {@link #discover()}.
     * @param name unique server name
     * @param session session with the server, initialized or not
     * @return this adapter
     * @throws IllegalArgumentException if a server with this name was already added
     */
    public synchronized ToolAdapter addServer(String name, ClientSession session) {
        if (servers.putIfAbsent(name, session) != null) {
            throw new IllegalArgumentException("Server already added: " + name);
        }
        LOGGER.info("Added server {}", name);
        return this;
    }

    public synchronized List<String> servers() {
        return List.copyOf(servers.keySet());
    }

    /**
     * Fetch the tool lists of all servers and rebuild the catalog from them. Uninitialized sessions
     * are initialized first. A server that cannot be loaded is logged and skipped; when a tool name
     * is offered by several servers the first server added keeps it.
     * @return the operations in server order, then in the order each server lists them
     * @throws TransportException if every server failed and the first failure was a transport one
     * @throws ProtocolException if every server failed and the first failure was a protocol one
     */
    public List<RemoteTool> discover() throws TransportException, ProtocolException {
        Map<String, ClientSession> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(servers);
        }
        Map<String, RemoteTool> discovered = new LinkedHashMap<>();
        Exception firstFailure = null;
        int loaded = 0;
        for (Map.Entry<String, ClientSession> server : snapshot.entrySet()) {
            try {
                List<ToolDescriptor> descriptors = load(server.getValue());
                for (ToolDescriptor descriptor : descriptors) {
                    RemoteTool tool = new RemoteTool(server.getKey(), descriptor, server.getValue(), mapper);
                    RemoteTool existing = discovered.putIfAbsent(descriptor.name(), tool);
                    if (existing != null) {
                        LOGGER.warn("Tool {} of server {} is shadowed by server {}", descriptor.name(),
                            server.getKey(), existing.server());
                    }
                }
                loaded++;
                LOGGER.info("Loaded {} tools from {}", descriptors.size(), server.getKey());
            } catch (TransportException | ProtocolException | SessionException e) {
                LOGGER.error("Failed to load tools from {}: {}", server.getKey(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        operations = Collections.unmodifiableMap(discovered);
        if (loaded == 0 && firstFailure != null) {
            rethrow(firstFailure);
        }
        LOGGER.info("Discovered {} tools: {}", discovered.size(), discovered.keySet());
        return operations();
    }

    private static List<ToolDescriptor> load(ClientSession session) throws TransportException, ProtocolException {
        if (session.state() == SessionState.UNINITIALIZED) {
            session.initialize();
        }
        return session.listTools();
    }

    private static void rethrow(Exception failure) throws TransportException, ProtocolException {
        if (failure instanceof TransportException transportFailure) {
            throw transportFailure;
        }
        if (failure instanceof ProtocolException protocolFailure) {
            throw protocolFailure;
        }
        throw (RuntimeException) failure;
    }

    public List<RemoteTool> operations() {
        return List.copyOf(operations.values());
    }

    public Optional<RemoteTool> find(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    /**
     * Invoke a tool by name on the server that offers it. With a single server, names that were
     * not discovered are still sent, so the server stays the authority on which tools exist.
     * @param name tool name
     * @param arguments structured arguments
     * @return the tool's result, possibly a tool-level failure
     * @throws ProtocolException when the server rejects the call, or {@code TOOL_NOT_FOUND} when
     * several servers are configured and none offered the tool
     * @throws TransportException when the exchange fails
     */
    public InvocationResult invoke(String name, Map<String, ?> arguments) throws TransportException, ProtocolException {
        RemoteTool tool = operations.get(name);
        if (tool != null) {
            return tool.invoke(arguments);
        }
        ClientSession only;
        synchronized (this) {
            if (servers.size() != 1) {
                throw new ProtocolException(ProtocolError.of(ErrorCode.TOOL_NOT_FOUND, "Unknown tool: " + name));
            }
            only = servers.values().iterator().next();
        }
        JsonNode tree = mapper.valueToTree(arguments == null ? Map.of() : arguments);
        return only.callTool(name, tree);
    }

    /**
     * Close the sessions of all servers.
     */
    @Override
    public synchronized void close() {
        servers.forEach((name, session) -> {
            session.close();
            LOGGER.info("Closed server {}", name);
        });
    }
}
