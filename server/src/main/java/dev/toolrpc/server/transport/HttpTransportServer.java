package dev.toolrpc.server.transport;

import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.Method;
import dev.toolrpc.protocol.Protocol;
import dev.toolrpc.protocol.ProtocolError;
import dev.toolrpc.server.config.ToolServerProperties;
import dev.toolrpc.server.dispatch.Dispatcher;
import dev.toolrpc.server.session.Session;
import dev.toolrpc.server.session.SessionManager;
import dev.toolrpc.transport.DecodeException;
import dev.toolrpc.transport.Envelope;
import dev.toolrpc.transport.EnvelopeCodec;
import dev.toolrpc.transport.Wire;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * HTTP endpoint of the protocol. Each POST carries one request envelope and is answered with one
 * response envelope; the servlet container runs every call on its own thread. Bodies that fail to
 * decode never reach the {@link Dispatcher}.
 */
@RequiredArgsConstructor
public class HttpTransportServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransportServer.class);

    private final EnvelopeCodec codec;
    private final Dispatcher dispatcher;
    private final SessionManager sessions;
    private final ToolServerProperties properties;

    public RouterFunction<ServerResponse> routerFunction() {
        return RouterFunctions.route()
            .POST(properties.getEndpoint(), this::handlePost)
            .DELETE(properties.getEndpoint(), this::handleDelete)
            .GET("/health", request -> health())
            .GET("/", request -> info())
            .build();
    }

    private ServerResponse handlePost(ServerRequest request) throws IOException {
        byte[] body = request.servletRequest().getInputStream().readAllBytes();
        String sessionId = request.headers().firstHeader(Protocol.SESSION_HEADER);
        String peer = request.remoteAddress().map(Object::toString).orElse("unknown");
        Reply reply = handle(body, sessionId, peer);

        String json = codec.toJson(reply.envelope());
        Wire.tx(peer, reply.envelope(), json);
        ServerResponse.BodyBuilder builder = ServerResponse.status(reply.status()).contentType(MediaType.APPLICATION_JSON);
        if (reply.sessionId() != null) {
            builder.header(Protocol.SESSION_HEADER, reply.sessionId());
        }
        return builder.body(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decode, route and dispatch one inbound body. Never throws: every failure becomes an error
     * envelope.
     * @param body raw request body
     * @param sessionId value of the session header, or {@code null}
     * @param peer remote address for logging
     * @return HTTP status, response envelope and the session id to announce, if any
     */
    public Reply handle(byte[] body, String sessionId, String peer) {
        Envelope request;
        try {
            request = codec.decode(body);
        } catch (DecodeException e) {
            LOGGER.warn("Rejected malformed envelope from {}: {}", peer, e.getMessage());
            return new Reply(HttpStatus.BAD_REQUEST.value(), Envelope.error(e.requestId(), e.toProtocolError()), null);
        }
        Wire.rx(peer, request, new String(body, StandardCharsets.UTF_8));
        if (!request.isRequest()) {
            return new Reply(HttpStatus.BAD_REQUEST.value(), Envelope.error(request.id(),
                ProtocolError.of(ErrorCode.INVALID_REQUEST, "Expected a request envelope")), null);
        }

        try {
            boolean initialize = Method.fromWireName(request.method()).filter(Method.INITIALIZE::equals).isPresent();
            Session session;
            boolean created = false;
            if (sessionId == null) {
                session = initialize ? sessions.create() : null;
                created = initialize;
            } else {
                Optional<Session> existing = sessions.find(sessionId);
                if (existing.isEmpty()) {
                    return new Reply(HttpStatus.NOT_FOUND.value(), Envelope.error(request.id(),
                        ProtocolError.of(ErrorCode.NOT_INITIALIZED, "Unknown session: " + sessionId)), null);
                }
                session = existing.get();
            }

            Envelope response;
            if (session == null) {
                response = dispatcher.dispatch(request, null);
            } else {
                session.beginCall();
                try {
                    response = dispatcher.dispatch(request, session);
                } finally {
                    session.endCall();
                }
            }
            if (created && response.isError()) {
                sessions.discard(session.id());
            }
            String announced = created && !response.isError() ? session.id() : null;
            return new Reply(HttpStatus.OK.value(), response, announced);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to handle request {} from {}", request.id(), peer, e);
            return new Reply(HttpStatus.INTERNAL_SERVER_ERROR.value(), Envelope.error(request.id(),
                ProtocolError.of(ErrorCode.INTERNAL_ERROR, "Internal error")), null);
        }
    }

    private ServerResponse handleDelete(ServerRequest request) {
        String sessionId = request.headers().firstHeader(Protocol.SESSION_HEADER);
        if (sessionId == null) {
            return ServerResponse.badRequest().build();
        }
        if (!sessions.close(sessionId)) {
            return ServerResponse.notFound().build();
        }
        return ServerResponse.noContent().build();
    }

    private ServerResponse health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("server", properties.getName());
        return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(body);
    }

    private ServerResponse info() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("mcp", properties.getEndpoint());
        endpoints.put("health", "/health");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", properties.getName());
        body.put("version", properties.getVersion());
        body.put("protocolVersions", properties.getSupportedProtocolVersions());
        body.put("endpoints", endpoints);
        return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(body);
    }

    /**
     * Outcome of one POST.
     * @param status HTTP status code
     * @param envelope response envelope
     * @param sessionId session id to send in the session header, or {@code null}
     */
    public record Reply(int status, Envelope envelope, String sessionId) {
    }
}
