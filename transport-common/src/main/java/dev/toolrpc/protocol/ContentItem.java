package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * One item of an invocation result: either text produced by the tool or an error payload
 * describing why the tool failed.
 * @param type item kind
 * @param text text or error message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentItem(Type type, String text) {

    public enum Type {
        TEXT("text"),
        ERROR("error");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Type fromWireName(String name) {
            for (Type type : values()) {
                if (type.wireName.equals(name)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown content type: " + name);
        }
    }

    public ContentItem {
        Objects.requireNonNull(type, "type");
        text = text == null ? "" : text;
    }

    public static ContentItem text(String text) {
        return new ContentItem(Type.TEXT, text);
    }

    public static ContentItem error(String message) {
        return new ContentItem(Type.ERROR, message);
    }

    @JsonIgnore
    public boolean isError() {
        return type == Type.ERROR;
    }
}
