package dev.toolrpc.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.ToolDescriptor;
import dev.toolrpc.server.dispatch.ArgumentValidator;
import dev.toolrpc.server.dispatch.Dispatcher;
import dev.toolrpc.server.registry.ToolProvider;
import dev.toolrpc.server.registry.ToolRegistry;
import dev.toolrpc.server.session.SessionManager;
import dev.toolrpc.server.transport.HttpTransportServer;
import dev.toolrpc.transport.EnvelopeCodec;

/**
 * Spring configuration that assembles the protocol core: the tool registry populated from every
 * {@link ToolProvider} bean, the session manager, the dispatcher and the HTTP transport.
 */
@Configuration
@EnableConfigurationProperties(ToolServerProperties.class)
public class ToolServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(ToolServerConfig.class);

	@Bean
	public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
		return new EnvelopeCodec(objectMapper);
	}

	/**
	 * Build the immutable registry from the tool providers present in the context, in bean order.
	 * @param providers tool providers contributed by the application
	 * @return the populated registry
	 */
	@Bean
	public ToolRegistry toolRegistry(ObjectProvider<ToolProvider> providers) {
		ToolRegistry registry = ToolRegistry.builder().registerAll(providers.orderedStream().toList()).build();
		if (registry.isEmpty()) {
			logger.warn("No tool providers registered; tools/list will be empty");
		}
		else {
			logger.info("Registered {} tools: {}", registry.size(),
					registry.listTools().stream().map(ToolDescriptor::name).toList());
		}
		return registry;
	}

	@Bean(destroyMethod = "close")
	public SessionManager sessionManager(ToolServerProperties properties, ObjectMapper objectMapper) {
		ObjectNode capabilities = objectMapper.createObjectNode();
		capabilities.putObject("tools").put("listChanged", false);
		return new SessionManager(properties.getSupportedProtocolVersions(),
				new Implementation(properties.getName(), properties.getVersion()), capabilities,
				properties.getSessionIdleTimeout());
	}

	@Bean
	public ArgumentValidator argumentValidator(ObjectMapper objectMapper) {
		return new ArgumentValidator(objectMapper);
	}

	@Bean
	public Dispatcher dispatcher(ToolRegistry toolRegistry, ArgumentValidator argumentValidator,
			ObjectMapper objectMapper) {
		return new Dispatcher(toolRegistry, argumentValidator, objectMapper);
	}

	@Bean
	public HttpTransportServer httpTransportServer(EnvelopeCodec envelopeCodec, Dispatcher dispatcher,
			SessionManager sessionManager, ToolServerProperties properties) {
		logger.info("Protocol endpoint bound to {}", properties.getEndpoint());
		return new HttpTransportServer(envelopeCodec, dispatcher, sessionManager, properties);
	}

	@Bean
	public RouterFunction<ServerResponse> toolRpcRouter(HttpTransportServer httpTransportServer) {
		return httpTransportServer.routerFunction();
	}

}
