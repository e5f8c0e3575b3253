package dev.toolrpc.protocol;

import java.util.List;

/**
 * Protocol-wide constants shared by client and server.
 */
public final class Protocol {

    public static final String JSONRPC_VERSION = "2.0";

    public static final String LATEST_VERSION = "2024-11-05";

    public static final List<String> SUPPORTED_VERSIONS = List.of(LATEST_VERSION);

    /**
     * HTTP header carrying the server-assigned session id after {@code initialize}.
     */
    public static final String SESSION_HEADER = "Mcp-Session-Id";

    private Protocol() {
    }
}
