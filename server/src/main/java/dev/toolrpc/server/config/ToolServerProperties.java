package dev.toolrpc.server.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.toolrpc.protocol.Protocol;

/**
 * Configuration properties of the tool server: where the protocol endpoint is bound, how the
 * server identifies itself on {@code initialize}, which protocol versions it accepts and how long
 * an idle session is kept.
 */
@ConfigurationProperties(prefix = "toolrpc.server")
public class ToolServerProperties {

	/**
	 * HTTP endpoint path that accepts protocol envelopes. Defaults to {@code /mcp}.
	 */
	private String endpoint = "/mcp";

	/**
	 * Server name reported in {@code serverInfo}.
	 */
	private String name = "toolrpc-server";

	/**
	 * Server version reported in {@code serverInfo}.
	 */
	private String version = "0.1.0";

	/**
	 * Protocol versions accepted on {@code initialize}.
	 */
	private List<String> supportedProtocolVersions = new ArrayList<>(Protocol.SUPPORTED_VERSIONS);

	/**
	 * Sessions without traffic for longer than this are closed and forgotten.
	 */
	private Duration sessionIdleTimeout = Duration.ofMinutes(30);

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public List<String> getSupportedProtocolVersions() {
		return supportedProtocolVersions;
	}

	/**
	 * Update the accepted protocol versions.
	 * @param supportedProtocolVersions accepted versions, falling back to the latest version when
	 * empty
	 */
	public void setSupportedProtocolVersions(List<String> supportedProtocolVersions) {
		this.supportedProtocolVersions = supportedProtocolVersions == null || supportedProtocolVersions.isEmpty()
				? new ArrayList<>(Protocol.SUPPORTED_VERSIONS) : supportedProtocolVersions;
	}

	public Duration getSessionIdleTimeout() {
		return sessionIdleTimeout;
	}

	public void setSessionIdleTimeout(Duration sessionIdleTimeout) {
		this.sessionIdleTimeout = Objects.requireNonNullElse(sessionIdleTimeout, Duration.ofMinutes(30));
	}

}
