package dev.toolrpc.protocol;

/**
 * Lifecycle of a session. {@link #CLOSED} is terminal.
 */
public enum SessionState {
    UNINITIALIZED, INITIALIZED, CLOSED
}
