package dev.toolrpc.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of methods understood by the protocol.
 */
public enum Method {

    INITIALIZE("initialize"),
    TOOLS_LIST("tools/list"),
    TOOLS_CALL("tools/call");

    private final String wireName;

    Method(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Method> fromWireName(String name) {
        return Arrays.stream(values()).filter(method -> method.wireName.equals(name)).findFirst();
    }
}
