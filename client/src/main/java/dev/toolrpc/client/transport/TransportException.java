package dev.toolrpc.client.transport;

import java.io.IOException;

/**
 * Failure to exchange an envelope with the server. Each kind may be retried at the caller's
 * discretion; the transport itself never retries.
 */
public class TransportException extends IOException {

    public enum Kind {
        /** No response within the caller's timeout. The server may still complete the work. */
        TIMEOUT,
        /** Connection refused, reset or otherwise failed. */
        UNREACHABLE,
        /** The server answered with something that is not a matching response envelope. */
        MALFORMED
    }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
