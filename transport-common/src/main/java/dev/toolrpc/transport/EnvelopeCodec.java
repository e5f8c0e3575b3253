package dev.toolrpc.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.Protocol;
import dev.toolrpc.protocol.ProtocolError;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes envelopes as JSON-RPC 2.0 objects in UTF-8 and decodes them back. Stateless and safe
 * to share between threads.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] encode(Envelope envelope) {
        return toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public String toJson(Envelope envelope) {
        try {
            return mapper.writeValueAsString(toTree(envelope));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode envelope " + envelope.id(), e);
        }
    }

    private ObjectNode toTree(Envelope envelope) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", Protocol.JSONRPC_VERSION);
        RequestId id = envelope.id();
        if (id == null) {
            node.putNull("id");
        } else if (id.value() instanceof Long number) {
            node.put("id", number);
        } else {
            node.put("id", (String) id.value());
        }
        if (envelope.isRequest()) {
            node.put("method", envelope.method());
            if (envelope.params() != null) {
                node.set("params", envelope.params());
            }
        } else if (envelope.isError()) {
            ProtocolError error = envelope.error();
            ObjectNode errorNode = node.putObject("error");
            errorNode.put("code", error.code());
            errorNode.put("message", error.message());
            if (error.data() != null) {
                errorNode.set("data", error.data());
            }
        } else {
            node.set("result", envelope.result());
        }
        return node;
    }

    public Envelope decode(byte[] bytes) throws DecodeException {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new DecodeException(ErrorCode.PARSE_ERROR, "Invalid JSON: " + e.getOriginalMessage(), null, e);
        } catch (IOException e) {
            throw new DecodeException(ErrorCode.PARSE_ERROR, "Unreadable envelope: " + e.getMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException(ErrorCode.PARSE_ERROR, "Envelope is not a JSON object", null);
        }
        RequestId id = readId(root.get("id"));

        if (root.hasNonNull("method")) {
            if (id == null) {
                throw new DecodeException(ErrorCode.INVALID_REQUEST, "Request is missing id", null);
            }
            JsonNode method = root.get("method");
            if (!method.isTextual() || method.asText().isEmpty()) {
                throw new DecodeException(ErrorCode.INVALID_REQUEST, "Request method must be a non-empty string", id);
            }
            if (root.has("result") || root.has("error")) {
                throw new DecodeException(ErrorCode.INVALID_REQUEST, "Request must not carry result or error", id);
            }
            return Envelope.request(id, method.asText(), root.get("params"));
        }

        boolean hasResult = root.has("result");
        boolean hasError = root.hasNonNull("error");
        if (hasResult && hasError) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "Response carries both result and error", id);
        }
        if (!hasResult && !hasError) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "Envelope has neither method nor result/error", id);
        }
        if (hasError) {
            if (!root.has("id")) {
                throw new DecodeException(ErrorCode.INVALID_REQUEST, "Error response is missing id", null);
            }
            return Envelope.error(id, readError(root.get("error"), id));
        }
        if (id == null) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "Response is missing id", null);
        }
        return Envelope.result(id, root.get("result"));
    }

    private static RequestId readId(JsonNode idNode) throws DecodeException {
        if (idNode == null || idNode.isNull()) {
            return null;
        }
        if (idNode.isTextual()) {
            return RequestId.of(idNode.asText());
        }
        if (idNode.isIntegralNumber() && idNode.canConvertToLong()) {
            return RequestId.of(idNode.longValue());
        }
        throw new DecodeException(ErrorCode.INVALID_REQUEST, "id must be a string or an integer", null);
    }

    private static ProtocolError readError(JsonNode errorNode, RequestId id) throws DecodeException {
        if (!errorNode.isObject()) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "error must be an object", id);
        }
        JsonNode code = errorNode.get("code");
        JsonNode message = errorNode.get("message");
        if (code == null || !code.canConvertToInt() || !code.isIntegralNumber()) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "error.code must be an integer", id);
        }
        if (message == null || !message.isTextual()) {
            throw new DecodeException(ErrorCode.INVALID_REQUEST, "error.message must be a string", id);
        }
        JsonNode data = errorNode.get("data");
        return new ProtocolError(code.intValue(), message.asText(), data == null || data.isNull() ? null : data);
    }
}
