package dev.toolrpc.transport;

import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.ProtocolError;

/**
 * Raised when inbound bytes do not form a valid envelope. Carries the request id when it could be
 * read so that the error reply can still be correlated.
 */
public class DecodeException extends Exception {

    private final ErrorCode code;
    private final RequestId requestId;

    public DecodeException(ErrorCode code, String message, RequestId requestId) {
        this(code, message, requestId, null);
    }

    public DecodeException(ErrorCode code, String message, RequestId requestId, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.requestId = requestId;
    }

    public ErrorCode code() {
        return code;
    }

    public RequestId requestId() {
        return requestId;
    }

    public ProtocolError toProtocolError() {
        return ProtocolError.of(code, getMessage());
    }
}
