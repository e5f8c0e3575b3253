package dev.toolrpc.server.registry;

public class DuplicateToolNameException extends IllegalArgumentException {

    private final String toolName;

    public DuplicateToolNameException(String toolName) {
        super("A tool named '" + toolName + "' is already registered");
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
