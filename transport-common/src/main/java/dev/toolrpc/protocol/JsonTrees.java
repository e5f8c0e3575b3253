package dev.toolrpc.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Canonical form of JSON trees carried in messages. Numeric nodes compare by their node class, so
 * a tree built from a {@code long} and the same tree read back from the wire would differ; both
 * are brought to the shape a parser produces for their text.
 */
public final class JsonTrees {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonTrees() {
    }

    /**
     * Re-read a tree from its own serialized text.
     * @param node tree to normalize, may be {@code null}
     * @return the tree as parsed from its text, {@code null} for {@code null} or JSON {@code null}
     */
    public static JsonNode canonical(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return MAPPER.readTree(MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable JSON tree: " + e.getOriginalMessage(), e);
        }
    }
}
