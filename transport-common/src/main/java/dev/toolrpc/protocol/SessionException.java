package dev.toolrpc.protocol;

/**
 * Raised when an operation is not valid in the current {@link SessionState}, or when the
 * protocol version offered on {@code initialize} is not supported.
 */
public class SessionException extends IllegalStateException {

    public enum Kind {
        ALREADY_INITIALIZED(ErrorCode.ALREADY_INITIALIZED),
        PROTOCOL_MISMATCH(ErrorCode.PROTOCOL_MISMATCH),
        NOT_INITIALIZED(ErrorCode.NOT_INITIALIZED),
        CLOSED(ErrorCode.SESSION_CLOSED);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Kind kind;

    public SessionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public ProtocolError toProtocolError() {
        return ProtocolError.of(kind.errorCode(), getMessage());
    }
}
