package dev.toolrpc.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Protocol-level error codes. The first five are the standard JSON-RPC codes; the rest are
 * application codes in the implementation-defined server error range.
 */
public enum ErrorCode {

    PARSE_ERROR(-32700),
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_ARGUMENTS(-32602),
    INTERNAL_ERROR(-32603),
    TOOL_NOT_FOUND(-32001),
    NOT_INITIALIZED(-32002),
    ALREADY_INITIALIZED(-32003),
    PROTOCOL_MISMATCH(-32004),
    SESSION_CLOSED(-32005);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ErrorCode> fromCode(int code) {
        return Arrays.stream(values()).filter(value -> value.code == code).findFirst();
    }
}
