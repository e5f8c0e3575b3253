package dev.toolrpc.client.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.toolrpc.client.transport.HttpClientTransport;
import dev.toolrpc.client.transport.TransportException;
import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.InitializeRequest;
import dev.toolrpc.protocol.InitializeResult;
import dev.toolrpc.protocol.InvocationRequest;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.ListToolsResult;
import dev.toolrpc.protocol.Method;
import dev.toolrpc.protocol.Protocol;
import dev.toolrpc.protocol.SessionException;
import dev.toolrpc.protocol.SessionState;
import dev.toolrpc.protocol.ToolDescriptor;
import dev.toolrpc.transport.Envelope;
import dev.toolrpc.transport.RequestId;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of a session. Issues request ids, tracks the lifecycle and turns response envelopes
 * into results or {@link ProtocolException}s. Calls after {@link #initialize()} may be issued from
 * any number of threads at once.
 */
public class ClientSession implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientSession.class);

    private final HttpClientTransport transport;
    private final ObjectMapper mapper;
    private final Implementation clientInfo;
    private final Duration requestTimeout;
    private final AtomicLong requestCounter = new AtomicLong();

    private volatile SessionState state = SessionState.UNINITIALIZED;
    private volatile InitializeResult negotiated;

    public ClientSession(HttpClientTransport transport, Implementation clientInfo, Duration requestTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = transport.codec().mapper();
        this.clientInfo = Objects.requireNonNull(clientInfo, "clientInfo");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * Next request id of this session. Strictly increasing, never reused, safe under concurrent
     * callers.
     * @return a fresh id
     */
    public long nextRequestId() {
        return requestCounter.incrementAndGet();
    }

    public SessionState state() {
        return state;
    }

    public InitializeResult negotiated() {
        return negotiated;
    }

    /**
     * Perform the {@code initialize} handshake.
     * @return protocol version, capabilities and identity of the server
     * @throws SessionException {@code ALREADY_INITIALIZED} on a second call, {@code CLOSED} after
     * {@link #close()}, {@code PROTOCOL_MISMATCH} if the server picks a version this client does
     * not speak
     */
    public synchronized InitializeResult initialize() throws TransportException, ProtocolException {
        switch (state) {
            case INITIALIZED -> throw new SessionException(SessionException.Kind.ALREADY_INITIALIZED,
                "Session is already initialized");
            case CLOSED -> throw new SessionException(SessionException.Kind.CLOSED, "Session is closed");
            default -> {
            }
        }
        ObjectNode capabilities = mapper.createObjectNode();
        capabilities.putObject("tools");
        InitializeRequest request = new InitializeRequest(Protocol.LATEST_VERSION, clientInfo, capabilities);
        InitializeResult result = convert(call(Method.INITIALIZE, mapper.valueToTree(request)), InitializeResult.class);
        if (!Protocol.SUPPORTED_VERSIONS.contains(result.protocolVersion())) {
            terminateQuietly();
            throw new SessionException(SessionException.Kind.PROTOCOL_MISMATCH,
                "Server selected unsupported protocol version " + result.protocolVersion());
        }
        negotiated = result;
        state = SessionState.INITIALIZED;
        LOGGER.info("Initialized session {} with {} (protocol {})", transport.sessionId(), result.serverInfo(),
            result.protocolVersion());
        return result;
    }

    public List<ToolDescriptor> listTools() throws TransportException, ProtocolException {
        requireInitialized();
        return convert(call(Method.TOOLS_LIST, null), ListToolsResult.class).tools();
    }

    /**
     * Invoke a tool. A tool-level failure is returned as a result with {@code isError() == true}.
     * @param name tool name
     * @param arguments argument object
     * @return the invocation result
     * @throws ProtocolException when the server rejects the call before running the tool
     * @throws TransportException when the exchange itself fails
     */
    public InvocationResult callTool(String name, JsonNode arguments) throws TransportException, ProtocolException {
        requireInitialized();
        InvocationRequest request = new InvocationRequest(name, arguments == null ? mapper.createObjectNode() : arguments);
        return convert(call(Method.TOOLS_CALL, mapper.valueToTree(request)), InvocationResult.class);
    }

    private JsonNode call(Method method, JsonNode params) throws TransportException, ProtocolException {
        Envelope request = Envelope.request(RequestId.of(nextRequestId()), method.wireName(), params);
        Envelope response = transport.send(request, requestTimeout);
        if (response.isError()) {
            throw new ProtocolException(response.error());
        }
        return response.result();
    }

    private <T> T convert(JsonNode result, Class<T> type) throws TransportException {
        if (result == null || !result.isObject()) {
            throw new TransportException(TransportException.Kind.MALFORMED,
                "Expected a " + type.getSimpleName() + " object but got " + result);
        }
        try {
            return mapper.treeToValue(result, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransportException(TransportException.Kind.MALFORMED,
                "Unexpected " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
    }

    private void requireInitialized() {
        switch (state) {
            case UNINITIALIZED -> throw new SessionException(SessionException.Kind.NOT_INITIALIZED,
                "Session is not initialized");
            case CLOSED -> throw new SessionException(SessionException.Kind.CLOSED, "Session is closed");
            default -> {
            }
        }
    }

    /**
     * Close the session and ask the server to drop it. Terminal; failures to reach the server are
     * logged.
     */
    @Override
    public synchronized void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        boolean wasInitialized = state == SessionState.INITIALIZED;
        state = SessionState.CLOSED;
        if (wasInitialized) {
            terminateQuietly();
        }
    }

    private void terminateQuietly() {
        try {
            transport.terminateSession(requestTimeout);
        } catch (TransportException e) {
            LOGGER.warn("Failed to terminate server session: {}", e.getMessage());
        }
    }
}
