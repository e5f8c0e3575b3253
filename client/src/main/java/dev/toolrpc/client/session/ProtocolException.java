package dev.toolrpc.client.session;

import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.ProtocolError;
import java.util.Optional;

/**
 * The server answered a request with a protocol-level error: the request was malformed, named an
 * unknown method or tool, carried invalid arguments, or violated the session state. The tool
 * never ran.
 */
public class ProtocolException extends Exception {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public ProtocolError error() {
        return error;
    }

    public Optional<ErrorCode> errorCode() {
        return error.errorCode();
    }
}
