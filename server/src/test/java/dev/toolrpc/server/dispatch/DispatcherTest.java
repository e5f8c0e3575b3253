package dev.toolrpc.server.dispatch;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.InitializeRequest;
import dev.toolrpc.protocol.InputSchema;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.JsonType;
import dev.toolrpc.protocol.ToolDescriptor;
import dev.toolrpc.server.registry.ToolExecutor;
import dev.toolrpc.server.registry.ToolRegistry;
import dev.toolrpc.server.session.Session;
import dev.toolrpc.transport.Envelope;
import dev.toolrpc.transport.RequestId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DispatcherTest {

	private static final InputSchema ADD_SCHEMA = InputSchema.builder()
		.required("a", JsonType.INTEGER, "first operand")
		.required("b", JsonType.INTEGER, "second operand")
		.additionalProperties(false)
		.build();

	private final ObjectMapper mapper = new ObjectMapper();

	private ToolExecutor add;

	private ToolExecutor failing;

	private Dispatcher dispatcher;

	private Session session;

	@BeforeEach
	void setUp() throws Exception {
		add = spy(new AddExecutor());
		failing = mock(ToolExecutor.class);
		when(failing.execute(any())).thenThrow(new IllegalStateException("disk full"));

		ToolRegistry registry = ToolRegistry.builder()
			.register(new ToolDescriptor("add", "Add two integers", ADD_SCHEMA), add)
			.register(new ToolDescriptor("explode", "Always fails", InputSchema.empty()), failing)
			.build();
		dispatcher = new Dispatcher(registry, mapper);
		session = new Session("s-1", List.of("2024-11-05"), new Implementation("test-server", "1.0"),
				mapper.createObjectNode(), Clock.systemUTC());
	}

	private void initialize() {
		session.initialize(new InitializeRequest("2024-11-05", new Implementation("test-client", "1.0"), null));
	}

	private Envelope call(long id, String tool, ObjectNode arguments) {
		ObjectNode params = mapper.createObjectNode();
		params.put("name", tool);
		if (arguments != null) {
			params.set("arguments", arguments);
		}
		return dispatcher.dispatch(Envelope.request(RequestId.of(id), "tools/call", params), session);
	}

	private ObjectNode args(Object... pairs) {
		ObjectNode node = mapper.createObjectNode();
		for (int i = 0; i < pairs.length; i += 2) {
			node.set((String) pairs[i], mapper.valueToTree(pairs[i + 1]));
		}
		return node;
	}

	@Test
	void initializeThroughDispatcher() {
		ObjectNode params = mapper.createObjectNode();
		params.put("protocolVersion", "2024-11-05");
		params.putObject("clientInfo").put("name", "test-client").put("version", "1.0");

		Envelope response = dispatcher.dispatch(Envelope.request(RequestId.of("init"), "initialize", params), session);

		assertThat(response.isError()).isFalse();
		assertThat(response.id()).isEqualTo(RequestId.of("init"));
		assertThat(response.result().get("protocolVersion").asText()).isEqualTo("2024-11-05");
		assertThat(response.result().get("serverInfo").get("name").asText()).isEqualTo("test-server");
	}

	@Test
	void listToolsNeverExposesExecutors() {
		initialize();

		Envelope response = dispatcher.dispatch(Envelope.request(RequestId.of(1), "tools/list", null), session);

		JsonNode tools = response.result().get("tools");
		assertThat(tools.size()).isEqualTo(2);
		assertThat(tools.get(0).get("name").asText()).isEqualTo("add");
		assertThat(tools.get(0).get("inputSchema").get("required").size()).isEqualTo(2);
		assertThat(tools.get(0).has("executor")).isFalse();
		verifyNoInteractions(failing);
	}

	@Test
	void callsToolWithValidArguments() throws Exception {
		initialize();

		Envelope response = call(2, "add", args("a", 2, "b", 3));

		assertThat(response.id()).isEqualTo(RequestId.of(2));
		InvocationResult result = mapper.treeToValue(response.result(), InvocationResult.class);
		assertThat(result.isError()).isFalse();
		assertThat(result.joinedText()).isEqualTo("5");
	}

	@Test
	void missingRequiredArgumentIsRejectedBeforeExecution() throws Exception {
		initialize();

		Envelope response = call(3, "add", args("a", 2));

		assertThat(response.error().errorCode()).contains(ErrorCode.INVALID_ARGUMENTS);
		assertThat(response.error().message()).startsWith("Invalid arguments for tool 'add'").contains("$.b");
		assertThat(response.error().data().get("violations").size()).isEqualTo(1);
		verify(add, never()).execute(any());
	}

	@Test
	void everyViolationIsReported() {
		initialize();

		Envelope response = call(4, "add", args("a", "two", "c", true));

		JsonNode violations = response.error().data().get("violations");
		assertThat(violations.size()).isEqualTo(3);
	}

	@Test
	void unknownToolIsToolNotFound() {
		initialize();

		Envelope response = call(5, "sub", args("a", 2, "b", 3));

		assertThat(response.error().errorCode()).contains(ErrorCode.TOOL_NOT_FOUND);
		assertThat(response.error().message()).isEqualTo("Unknown tool: sub");
	}

	@Test
	void missingToolNameIsInvalidArguments() {
		initialize();

		Envelope response = dispatcher.dispatch(
				Envelope.request(RequestId.of(6), "tools/call", mapper.createObjectNode()), session);

		assertThat(response.error().errorCode()).contains(ErrorCode.INVALID_ARGUMENTS);
	}

	@Test
	void unknownMethodIsMethodNotFound() {
		initialize();

		Envelope response = dispatcher.dispatch(Envelope.request(RequestId.of(7), "resources/list", null), session);

		assertThat(response.error().errorCode()).contains(ErrorCode.METHOD_NOT_FOUND);
	}

	@Test
	void failingToolIsAToolLevelError() throws Exception {
		initialize();

		Envelope response = call(8, "explode", null);

		assertThat(response.isError()).isFalse();
		InvocationResult result = mapper.treeToValue(response.result(), InvocationResult.class);
		assertThat(result.isError()).isTrue();
		assertThat(result.joinedText()).contains("disk full");
	}

	@Test
	void callsBeforeInitializeAreRejected() {
		Envelope response = call(9, "add", args("a", 2, "b", 3));

		assertThat(response.error().errorCode()).contains(ErrorCode.NOT_INITIALIZED);
		verifyNoInteractions(add);
	}

	@Test
	void callsWithoutSessionAreRejected() {
		Envelope response = dispatcher.dispatch(Envelope.request(RequestId.of(10), "tools/list", null), null);

		assertThat(response.error().errorCode()).contains(ErrorCode.NOT_INITIALIZED);
	}

	@Test
	void callsAfterCloseAreRejected() {
		initialize();
		session.close();

		Envelope response = call(11, "add", args("a", 2, "b", 3));

		assertThat(response.error().errorCode()).contains(ErrorCode.SESSION_CLOSED);
	}

	@Test
	void secondInitializeIsRejected() {
		initialize();
		ObjectNode params = mapper.createObjectNode();
		params.put("protocolVersion", "2024-11-05");

		Envelope response = dispatcher.dispatch(Envelope.request(RequestId.of(12), "initialize", params), session);

		assertThat(response.error().errorCode()).contains(ErrorCode.ALREADY_INITIALIZED);
	}

	@Test
	void slowToolDoesNotBlockOtherCalls() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		ToolExecutor blocking = arguments -> {
			release.await(5, TimeUnit.SECONDS);
			return InvocationResult.text("released");
		};
		ToolRegistry registry = ToolRegistry.builder()
			.register(new ToolDescriptor("block", "Blocks until released", InputSchema.empty()), blocking)
			.register(new ToolDescriptor("add", "Add two integers", ADD_SCHEMA), add)
			.build();
		Dispatcher concurrent = new Dispatcher(registry, mapper);
		initialize();

		ExecutorService pool = Executors.newFixedThreadPool(2);
		try {
			ObjectNode blockParams = mapper.createObjectNode().put("name", "block");
			Future<Envelope> blocked = pool
				.submit(() -> concurrent.dispatch(Envelope.request(RequestId.of(20), "tools/call", blockParams), session));

			ObjectNode addParams = mapper.createObjectNode().put("name", "add");
			addParams.set("arguments", args("a", 1, "b", 1));
			Envelope fast = pool
				.submit(() -> concurrent.dispatch(Envelope.request(RequestId.of(21), "tools/call", addParams), session))
				.get(2, TimeUnit.SECONDS);

			assertThat(fast.id()).isEqualTo(RequestId.of(21));
			assertThat(blocked.isDone()).isFalse();

			release.countDown();
			assertThat(blocked.get(2, TimeUnit.SECONDS).id()).isEqualTo(RequestId.of(20));
		}
		finally {
			pool.shutdownNow();
		}
	}

	static class AddExecutor implements ToolExecutor {

		@Override
		public InvocationResult execute(JsonNode arguments) {
			return InvocationResult.text(String.valueOf(arguments.get("a").asLong() + arguments.get("b").asLong()));
		}

	}

}
