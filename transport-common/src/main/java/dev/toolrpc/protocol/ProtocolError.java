package dev.toolrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code error} member of a response envelope.
 */
public record ProtocolError(int code, String message, JsonNode data) {

    public ProtocolError {
        Objects.requireNonNull(message, "message");
        data = JsonTrees.canonical(data);
    }

    public static ProtocolError of(ErrorCode code, String message) {
        return new ProtocolError(code.code(), message, null);
    }

    public static ProtocolError of(ErrorCode code, String message, JsonNode data) {
        return new ProtocolError(code.code(), message, data);
    }

    public Optional<ErrorCode> errorCode() {
        return ErrorCode.fromCode(code);
    }
}
