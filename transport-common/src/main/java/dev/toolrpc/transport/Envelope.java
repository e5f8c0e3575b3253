package dev.toolrpc.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.toolrpc.protocol.JsonTrees;
import dev.toolrpc.protocol.ProtocolError;
import java.util.Objects;

/**
 * One protocol message. A request carries {@code method} and optional {@code params}; a response
 * carries exactly one of {@code result} or {@code error}. Only an error response may have a
 * {@code null} id, for replies to requests whose id could not be read.
 */
public record Envelope(
    RequestId id,
    String method,
    JsonNode params,
    JsonNode result,
    ProtocolError error
) {

    public Envelope {
        params = JsonTrees.canonical(params);
        if (result != null) {
            JsonNode canonicalResult = JsonTrees.canonical(result);
            result = canonicalResult == null ? NullNode.getInstance() : canonicalResult;
        }
        if (method != null) {
            Objects.requireNonNull(id, "request id");
            if (result != null || error != null) {
                throw new IllegalArgumentException("A request must not carry a result or an error");
            }
        } else {
            if (params != null) {
                throw new IllegalArgumentException("A response must not carry params");
            }
            if ((result == null) == (error == null)) {
                throw new IllegalArgumentException("A response carries exactly one of result or error");
            }
            if (id == null && error == null) {
                throw new IllegalArgumentException("A result response requires an id");
            }
        }
    }

    public static Envelope request(RequestId id, String method, JsonNode params) {
        return new Envelope(id, Objects.requireNonNull(method, "method"), params, null, null);
    }

    public static Envelope result(RequestId id, JsonNode result) {
        return new Envelope(id, null, null, result == null ? NullNode.getInstance() : result, null);
    }

    public static Envelope error(RequestId id, ProtocolError error) {
        return new Envelope(id, null, null, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isRequest() {
        return method != null;
    }

    public boolean isError() {
        return error != null;
    }
}
