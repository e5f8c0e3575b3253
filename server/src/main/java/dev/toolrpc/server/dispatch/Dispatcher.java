package dev.toolrpc.server.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.InitializeRequest;
import dev.toolrpc.protocol.InitializeResult;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.ListToolsResult;
import dev.toolrpc.protocol.Method;
import dev.toolrpc.protocol.ProtocolError;
import dev.toolrpc.protocol.SessionException;
import dev.toolrpc.server.registry.RegisteredTool;
import dev.toolrpc.server.registry.ToolRegistry;
import dev.toolrpc.server.session.Session;
import dev.toolrpc.transport.Envelope;
import dev.toolrpc.transport.RequestId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a decoded request to its handler and always answers with exactly one response envelope.
 * Holds no mutable state, so any number of requests may be dispatched concurrently; tool
 * executions are never serialized against each other.
 */
public class Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    private final ToolRegistry registry;
    private final ArgumentValidator validator;
    private final ObjectMapper mapper;

    public Dispatcher(ToolRegistry registry, ObjectMapper mapper) {
        this(registry, new ArgumentValidator(mapper), mapper);
    }

    public Dispatcher(ToolRegistry registry, ArgumentValidator validator, ObjectMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Handle one request.
     * @param request decoded request envelope
     * @param session the caller's session, or {@code null} when the caller has none yet
     * @return the response envelope, carrying the request id
     */
    public Envelope dispatch(Envelope request, Session session) {
        RequestId id = request.id();
        Optional<Method> method = Method.fromWireName(request.method());
        if (method.isEmpty()) {
            return error(id, ErrorCode.METHOD_NOT_FOUND, "Method not found: " + request.method());
        }
        try {
            return switch (method.get()) {
                case INITIALIZE -> handleInitialize(id, request.params(), session);
                case TOOLS_LIST -> handleToolsList(id, session);
                case TOOLS_CALL -> handleToolsCall(id, request.params(), session);
            };
        } catch (SessionException e) {
            LOGGER.debug("Rejected {} for session state: {}", request.method(), e.getMessage());
            return Envelope.error(id, e.toProtocolError());
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure handling {} (id={})", request.method(), id, e);
            return error(id, ErrorCode.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private Envelope handleInitialize(RequestId id, JsonNode params, Session session) {
        if (session == null) {
            return error(id, ErrorCode.NOT_INITIALIZED, "No session available for initialize");
        }
        InitializeRequest initializeRequest;
        try {
            initializeRequest = params == null ? null : mapper.treeToValue(params, InitializeRequest.class);
        } catch (JsonProcessingException e) {
            return error(id, ErrorCode.INVALID_ARGUMENTS, "Invalid initialize params: " + e.getOriginalMessage());
        }
        InitializeResult result = session.initialize(initializeRequest);
        LOGGER.info("Session {} initialized with protocol {} by {}", session.id(), result.protocolVersion(),
            initializeRequest.clientInfo());
        return Envelope.result(id, mapper.valueToTree(result));
    }

    private Envelope handleToolsList(RequestId id, Session session) {
        requireSession(session);
        return Envelope.result(id, mapper.valueToTree(new ListToolsResult(registry.listTools())));
    }

    private Envelope handleToolsCall(RequestId id, JsonNode params, Session session) {
        requireSession(session);
        if (params == null || !params.isObject()) {
            return error(id, ErrorCode.INVALID_ARGUMENTS, "tools/call params must be an object");
        }
        JsonNode nameNode = params.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            return error(id, ErrorCode.INVALID_ARGUMENTS, "tools/call params.name must be a string");
        }
        String toolName = nameNode.asText();
        Optional<RegisteredTool> tool = registry.find(toolName);
        if (tool.isEmpty()) {
            return error(id, ErrorCode.TOOL_NOT_FOUND, "Unknown tool: " + toolName);
        }

        JsonNode arguments = params.get("arguments");
        if (arguments == null || arguments.isNull()) {
            arguments = mapper.createObjectNode();
        }
        List<String> violations = validator.validate(tool.get().descriptor(), arguments);
        if (!violations.isEmpty()) {
            ObjectNode data = mapper.createObjectNode();
            ArrayNode list = data.putArray("violations");
            violations.forEach(list::add);
            return Envelope.error(id, ProtocolError.of(ErrorCode.INVALID_ARGUMENTS,
                "Invalid arguments for tool '" + toolName + "': " + String.join("; ", violations), data));
        }

        InvocationResult result = execute(tool.get(), arguments);
        return Envelope.result(id, mapper.valueToTree(result));
    }

    private InvocationResult execute(RegisteredTool tool, JsonNode arguments) {
        LOGGER.debug("Executing tool {} with {}", tool.name(), arguments);
        try {
            InvocationResult result = tool.executor().execute(arguments);
            return result == null ? new InvocationResult(List.of()) : result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Tool {} was interrupted", tool.name());
            return InvocationResult.error("Tool '" + tool.name() + "' was interrupted");
        } catch (Exception e) {
            LOGGER.warn("Tool {} failed", tool.name(), e);
            return InvocationResult.error("Tool '" + tool.name() + "' failed: " + e.getMessage());
        }
    }

    private static void requireSession(Session session) {
        if (session == null) {
            throw new SessionException(SessionException.Kind.NOT_INITIALIZED, "No session; call initialize first");
        }
        session.requireInitialized();
    }

    private static Envelope error(RequestId id, ErrorCode code, String message) {
        return Envelope.error(id, ProtocolError.of(code, message));
    }
}
