package dev.toolrpc.server.registry;

import dev.toolrpc.protocol.ToolDescriptor;

/**
 * A tool contributed at startup. Every {@code ToolProvider} bean in the server context is
 * registered in bean order.
 */
public interface ToolProvider extends ToolExecutor {

    ToolDescriptor descriptor();
}
