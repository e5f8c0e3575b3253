package dev.toolrpc.client.adapter;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.toolrpc.client.session.ClientSession;
import dev.toolrpc.client.session.ProtocolException;
import dev.toolrpc.client.transport.TransportException;
import dev.toolrpc.protocol.ErrorCode;
import dev.toolrpc.protocol.InputSchema;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.JsonType;
import dev.toolrpc.protocol.SessionState;
import dev.toolrpc.protocol.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolAdapterTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private ClientSession session;

	private ToolAdapter adapter;

	@BeforeEach
	void setUp() throws Exception {
		session = mock(ClientSession.class);
		when(session.listTools()).thenReturn(List.of(
				new ToolDescriptor("add", "Add two integers",
						InputSchema.builder()
							.required("a", JsonType.INTEGER, "first operand")
							.required("b", JsonType.INTEGER, "second operand")
							.build()),
				new ToolDescriptor("weather", "Current weather",
						InputSchema.builder()
							.required("city", JsonType.STRING, "city name")
							.property("units", JsonType.STRING, "metric or imperial")
							.build())));
		when(session.callTool(any(), any())).thenReturn(InvocationResult.text("5"));
		adapter = new ToolAdapter(session, mapper);
	}

	@Test
	void discoverBuildsOperationsFromDescriptors() throws Exception {
		List<RemoteTool> tools = adapter.discover();

		assertThat(tools).extracting(RemoteTool::name).containsExactly("add", "weather");
		assertThat(tools.get(0).signature()).isEqualTo("add(a: integer, b: integer)");
		assertThat(tools.get(1).signature()).isEqualTo("weather(city: string, units?: string)");
		assertThat(tools.get(1).parameters()).containsExactly(
				new ToolParameter("city", JsonType.STRING, true, "city name"),
				new ToolParameter("units", JsonType.STRING, false, "metric or imperial"));
		assertThat(adapter.operations()).hasSize(2);
	}

	@Test
	void operationsAreEmptyBeforeDiscovery() {
		assertThat(adapter.operations()).isEmpty();
		assertThat(adapter.find("add")).isEmpty();
	}

	@Test
	void remoteToolInvokesThroughSession() throws Exception {
		adapter.discover();

		InvocationResult result = adapter.find("add").orElseThrow().invoke(Map.of("a", 2, "b", 3));

		ArgumentCaptor<JsonNode> arguments = ArgumentCaptor.forClass(JsonNode.class);
		verify(session).callTool(eq("add"), arguments.capture());
		assertThat(arguments.getValue().get("a").asInt()).isEqualTo(2);
		assertThat(arguments.getValue().get("b").asInt()).isEqualTo(3);
		assertThat(result.joinedText()).isEqualTo("5");
	}

	@Test
	void invokeByNameDelegatesEvenForUndiscoveredTools() throws Exception {
		adapter.invoke("sub", Map.of("a", 5, "b", 3));

		verify(session).callTool(eq("sub"), any());
	}

	@Test
	void unreachableServerDoesNotStopDiscoveryOfOthers() throws Exception {
		ClientSession down = mock(ClientSession.class);
		when(down.state()).thenReturn(SessionState.UNINITIALIZED);
		when(down.initialize()).thenThrow(new TransportException(TransportException.Kind.UNREACHABLE, "refused"));
		ToolAdapter combined = new ToolAdapter(mapper).addServer("down", down).addServer("math", session);

		List<RemoteTool> tools = combined.discover();

		assertThat(tools).extracting(RemoteTool::name).containsExactly("add", "weather");
		assertThat(tools).extracting(RemoteTool::server).containsOnly("math");
		verify(down, never()).listTools();
	}

	@Test
	void discoveryFailsWhenEveryServerFails() throws Exception {
		ClientSession down = mock(ClientSession.class);
		when(down.listTools()).thenThrow(new TransportException(TransportException.Kind.UNREACHABLE, "refused"));
		ToolAdapter combined = new ToolAdapter(mapper).addServer("down", down);

		assertThatThrownBy(combined::discover).isInstanceOfSatisfying(TransportException.class,
				e -> assertThat(e.kind()).isEqualTo(TransportException.Kind.UNREACHABLE));
		assertThat(combined.operations()).isEmpty();
	}

	@Test
	void uninitializedServersAreInitializedBeforeListing() throws Exception {
		ClientSession fresh = mock(ClientSession.class);
		when(fresh.state()).thenReturn(SessionState.UNINITIALIZED);
		when(fresh.listTools()).thenReturn(List.of());
		new ToolAdapter(mapper).addServer("fresh", fresh).discover();

		verify(fresh).initialize();
		verify(fresh).listTools();
	}

	@Test
	void invokeRoutesToOwningServer() throws Exception {
		ClientSession echo = mock(ClientSession.class);
		when(echo.listTools()).thenReturn(List.of(
				new ToolDescriptor("echo", "Echo text",
						InputSchema.builder().required("text", JsonType.STRING, "text to echo").build()),
				new ToolDescriptor("add", "Shadowed add", InputSchema.builder().build())));
		when(echo.callTool(any(), any())).thenReturn(InvocationResult.text("hi"));
		ToolAdapter combined = new ToolAdapter(mapper).addServer("math", session).addServer("echo", echo);
		combined.discover();

		assertThat(combined.operations()).extracting(RemoteTool::name).containsExactly("add", "weather", "echo");
		assertThat(combined.find("add").orElseThrow().server()).isEqualTo("math");

		assertThat(combined.invoke("echo", Map.of("text", "hi")).joinedText()).isEqualTo("hi");
		combined.invoke("add", Map.of("a", 1, "b", 2));

		verify(echo).callTool(eq("echo"), any());
		verify(session).callTool(eq("add"), any());
		verify(echo, never()).callTool(eq("add"), any());
	}

	@Test
	void unknownToolWithSeveralServersIsToolNotFound() throws Exception {
		ToolAdapter combined = new ToolAdapter(mapper).addServer("a", session).addServer("b", mock(ClientSession.class));

		assertThatThrownBy(() -> combined.invoke("missing", Map.of()))
			.isInstanceOfSatisfying(ProtocolException.class,
					e -> assertThat(e.error().code()).isEqualTo(ErrorCode.TOOL_NOT_FOUND.code()));
		verify(session, never()).callTool(any(), any());
	}

	@Test
	void serverNamesMustBeUnique() {
		assertThatThrownBy(() -> adapter.addServer(ToolAdapter.DEFAULT_SERVER, mock(ClientSession.class)))
			.isInstanceOf(IllegalArgumentException.class);
		assertThat(adapter.servers()).containsExactly(ToolAdapter.DEFAULT_SERVER);
	}

	@Test
	void closeClosesEverySession() {
		ClientSession other = mock(ClientSession.class);
		adapter.addServer("other", other);

		adapter.close();

		verify(session).close();
		verify(other).close();
	}

}
