package dev.toolrpc.server.session;

import com.fasterxml.jackson.databind.JsonNode;
import dev.toolrpc.protocol.Implementation;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the sessions of all connected clients. HTTP has no disconnect signal, so sessions idle for
 * longer than the configured timeout are closed and dropped; the sweep runs whenever a session is
 * created.
 */
public class SessionManager implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<String> supportedVersions;
    private final Implementation serverInfo;
    private final JsonNode serverCapabilities;
    private final Duration idleTimeout;
    private final Clock clock;

    public SessionManager(List<String> supportedVersions, Implementation serverInfo, JsonNode serverCapabilities,
        Duration idleTimeout) {
        this(supportedVersions, serverInfo, serverCapabilities, idleTimeout, Clock.systemUTC());
    }

    public SessionManager(List<String> supportedVersions, Implementation serverInfo, JsonNode serverCapabilities,
        Duration idleTimeout, Clock clock) {
        this.supportedVersions = List.copyOf(supportedVersions);
        this.serverInfo = serverInfo;
        this.serverCapabilities = serverCapabilities;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    public Session create() {
        evictIdle();
        String id = "s-" + UUID.randomUUID();
        Session session = new Session(id, supportedVersions, serverInfo, serverCapabilities, clock);
        sessions.put(id, session);
        LOGGER.debug("Created session {}", id);
        return session;
    }

    public Optional<Session> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(sessions.get(id));
    }

    /**
     * Close a session. The closed session stays known until it is evicted, so later calls carrying
     * its id are answered with a session-closed error rather than an unknown-session error.
     * @param id session id
     * @return {@code true} if a session with this id exists
     */
    public boolean close(String id) {
        Session session = sessions.get(id);
        if (session == null) {
            return false;
        }
        if (session.close()) {
            LOGGER.info("Session {} closed", id);
        }
        return true;
    }

    /**
     * Forget a session that never completed {@code initialize}.
     * @param id session id
     */
    public void discard(String id) {
        Session session = sessions.remove(id);
        if (session != null) {
            session.close();
        }
    }

    public int size() {
        return sessions.size();
    }

    void evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        sessions.values().removeIf(session -> {
            if (!session.isBusy() && session.lastAccess().isBefore(cutoff)) {
                session.close();
                LOGGER.info("Evicted idle session {}", session.id());
                return true;
            }
            return false;
        });
    }

    @Override
    public void close() {
        sessions.values().forEach(Session::close);
        sessions.clear();
        LOGGER.info("All sessions closed");
    }
}
