package dev.toolrpc.transport;

import java.util.Objects;

/**
 * Correlation token of an envelope. Either a string or an integer on the wire; the original type
 * is kept so that a response always echoes the id exactly as the request carried it.
 */
public record RequestId(Object value) {

    public RequestId {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String) && !(value instanceof Long)) {
            throw new IllegalArgumentException("Request id must be a String or Long: " + value.getClass());
        }
    }

    public static RequestId of(long value) {
        return new RequestId(value);
    }

    public static RequestId of(String value) {
        return new RequestId(value);
    }

    public boolean isNumeric() {
        return value instanceof Long;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
