package dev.toolrpc.server.session;

import java.time.Clock;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.InitializeRequest;
import dev.toolrpc.protocol.InitializeResult;
import dev.toolrpc.protocol.SessionException;
import dev.toolrpc.protocol.SessionState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private Session newSession() {
		ObjectNode capabilities = mapper.createObjectNode();
		capabilities.putObject("tools");
		return new Session("s-1", List.of("2024-11-05"), new Implementation("test-server", "1.0"), capabilities,
				Clock.systemUTC());
	}

	private static InitializeRequest request(String version, String clientName) {
		return new InitializeRequest(version, new Implementation(clientName, "1.0"), null);
	}

	@Test
	void initializeReturnsServerCapabilities() {
		Session session = newSession();

		InitializeResult result = session.initialize(request("2024-11-05", "first"));

		assertThat(result.protocolVersion()).isEqualTo("2024-11-05");
		assertThat(result.serverInfo().name()).isEqualTo("test-server");
		assertThat(result.capabilities().has("tools")).isTrue();
		assertThat(session.state()).isEqualTo(SessionState.INITIALIZED);
	}

	@Test
	void secondInitializeIsRejectedAndKeepsFirstNegotiation() {
		Session session = newSession();
		InitializeResult first = session.initialize(request("2024-11-05", "first"));

		assertThatThrownBy(() -> session.initialize(request("2024-11-05", "second")))
			.isInstanceOfSatisfying(SessionException.class,
					e -> assertThat(e.kind()).isEqualTo(SessionException.Kind.ALREADY_INITIALIZED));

		assertThat(session.negotiated()).isEqualTo(first);
		assertThat(session.clientRequest().clientInfo().name()).isEqualTo("first");
	}

	@Test
	void unsupportedVersionIsAProtocolMismatch() {
		Session session = newSession();

		assertThatThrownBy(() -> session.initialize(request("1999-01-01", "old")))
			.isInstanceOfSatisfying(SessionException.class,
					e -> assertThat(e.kind()).isEqualTo(SessionException.Kind.PROTOCOL_MISMATCH));
		assertThat(session.state()).isEqualTo(SessionState.UNINITIALIZED);
	}

	@Test
	void operationsRequireInitialization() {
		Session session = newSession();

		assertThatThrownBy(session::requireInitialized).isInstanceOfSatisfying(SessionException.class,
				e -> assertThat(e.kind()).isEqualTo(SessionException.Kind.NOT_INITIALIZED));
	}

	@Test
	void closedIsTerminal() {
		Session session = newSession();
		session.initialize(request("2024-11-05", "first"));

		assertThat(session.close()).isTrue();
		assertThat(session.close()).isFalse();
		assertThatThrownBy(session::requireInitialized).isInstanceOfSatisfying(SessionException.class,
				e -> assertThat(e.kind()).isEqualTo(SessionException.Kind.CLOSED));
		assertThatThrownBy(() -> session.initialize(request("2024-11-05", "again")))
			.isInstanceOfSatisfying(SessionException.class,
					e -> assertThat(e.kind()).isEqualTo(SessionException.Kind.CLOSED));
	}

}
