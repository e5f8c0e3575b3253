package dev.toolrpc.server.session;

import com.fasterxml.jackson.databind.JsonNode;
import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.InitializeRequest;
import dev.toolrpc.protocol.InitializeResult;
import dev.toolrpc.protocol.SessionException;
import dev.toolrpc.protocol.SessionState;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Server-side state of one client connection: lifecycle plus what was negotiated on
 * {@code initialize}. Moves {@code UNINITIALIZED -> INITIALIZED -> CLOSED}; {@code CLOSED} is
 * terminal.
 */
public final class Session {

    private final String id;
    private final List<String> supportedVersions;
    private final Implementation serverInfo;
    private final JsonNode serverCapabilities;
    private final Clock clock;

    private SessionState state = SessionState.UNINITIALIZED;
    private InitializeRequest clientRequest;
    private InitializeResult negotiated;
    private volatile Instant lastAccess;
    private final AtomicInteger activeCalls = new AtomicInteger();

    public Session(String id, List<String> supportedVersions, Implementation serverInfo, JsonNode serverCapabilities,
        Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.supportedVersions = List.copyOf(supportedVersions);
        this.serverInfo = serverInfo;
        this.serverCapabilities = serverCapabilities;
        this.clock = clock;
        this.lastAccess = clock.instant();
    }

    public String id() {
        return id;
    }

    public synchronized SessionState state() {
        return state;
    }

    /**
     * Negotiate the protocol version and establish the session.
     * @param request client version, identity and capabilities
     * @return the server capabilities
     * @throws SessionException {@code ALREADY_INITIALIZED} on a second call, {@code PROTOCOL_MISMATCH}
     * for an unsupported version, {@code CLOSED} once the session is closed
     */
    public synchronized InitializeResult initialize(InitializeRequest request) {
        touch();
        switch (state) {
            case CLOSED -> throw new SessionException(SessionException.Kind.CLOSED, "Session " + id + " is closed");
            case INITIALIZED -> throw new SessionException(SessionException.Kind.ALREADY_INITIALIZED,
                "Session " + id + " is already initialized");
            default -> {
            }
        }
        String requested = request == null ? null : request.protocolVersion();
        if (requested == null || !supportedVersions.contains(requested)) {
            throw new SessionException(SessionException.Kind.PROTOCOL_MISMATCH,
                "Unsupported protocol version " + requested + ", supported: " + supportedVersions);
        }
        this.clientRequest = request;
        this.negotiated = new InitializeResult(requested, serverCapabilities, serverInfo);
        this.state = SessionState.INITIALIZED;
        return negotiated;
    }

    /**
     * Guard for every method other than {@code initialize}.
     * @throws SessionException {@code NOT_INITIALIZED} before {@code initialize}, {@code CLOSED}
     * after {@link #close()}
     */
    public synchronized void requireInitialized() {
        touch();
        switch (state) {
            case UNINITIALIZED -> throw new SessionException(SessionException.Kind.NOT_INITIALIZED,
                "Session " + id + " is not initialized");
            case CLOSED -> throw new SessionException(SessionException.Kind.CLOSED, "Session " + id + " is closed");
            default -> {
            }
        }
    }

    public synchronized InitializeResult negotiated() {
        return negotiated;
    }

    public synchronized InitializeRequest clientRequest() {
        return clientRequest;
    }

    /**
     * Move to {@code CLOSED}.
     * @return {@code true} if this call closed the session, {@code false} if it was already closed
     */
    public synchronized boolean close() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.CLOSED;
        return true;
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    /**
     * Mark the start of a call routed to this session. A session with calls in progress is never
     * considered idle.
     */
    public void beginCall() {
        activeCalls.incrementAndGet();
        touch();
    }

    /**
     * Mark the end of a call started with {@link #beginCall()}; the idle period starts now.
     */
    public void endCall() {
        touch();
        activeCalls.decrementAndGet();
    }

    public boolean isBusy() {
        return activeCalls.get() > 0;
    }

    private void touch() {
        lastAccess = clock.instant();
    }
}
