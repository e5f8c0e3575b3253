package dev.toolrpc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.toolrpc.client.adapter.RemoteTool;
import dev.toolrpc.client.adapter.ToolAdapter;
import dev.toolrpc.client.adapter.ToolParameter;
import dev.toolrpc.client.session.ClientSession;
import dev.toolrpc.client.session.ProtocolException;
import dev.toolrpc.client.transport.HttpClientTransport;
import dev.toolrpc.client.transport.TransportException;
import dev.toolrpc.protocol.Implementation;
import dev.toolrpc.protocol.InitializeResult;
import dev.toolrpc.protocol.InvocationResult;
import dev.toolrpc.protocol.SessionException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(new ArrayList<>(Arrays.asList(args)), System.getenv(), System.out, System.err));
    }

    static int run(List<String> arguments, Map<String, String> environment, PrintStream out, PrintStream err) {
        ClientOptions options;
        try {
            options = ClientOptions.resolve(arguments, environment);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }
        if (arguments.isEmpty()) {
            printUsage(out);
            return 2;
        }
        String command = arguments.remove(0);

        HttpClientTransport transport = new HttpClientTransport(options.endpoint(), options.connectTimeout());
        ObjectMapper mapper = transport.codec().mapper();
        try (ClientSession session = new ClientSession(transport, new Implementation("toolrpc-console", "0.1.0"),
            options.requestTimeout())) {
            InitializeResult initialized = session.initialize();
            ToolAdapter adapter = new ToolAdapter(session, mapper);
            switch (command) {
                case "init" -> out.println("INIT protocol=" + initialized.protocolVersion()
                    + " server=" + initialized.serverInfo() + " capabilities=" + initialized.capabilities());
                case "list" -> handleList(adapter, out);
                case "call" -> {
                    return handleCall(adapter, mapper, arguments, out, err);
                }
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    return 2;
                }
            }
            return 0;
        } catch (ProtocolException e) {
            err.println("PROTOCOL ERROR " + e.error().code() + ": " + e.error().message());
            return 1;
        } catch (TransportException e) {
            err.println("TRANSPORT ERROR " + e.kind() + ": " + e.getMessage());
            return 1;
        } catch (SessionException e) {
            err.println("SESSION ERROR " + e.kind() + ": " + e.getMessage());
            return 1;
        }
    }

    private static void handleList(ToolAdapter adapter, PrintStream out) throws TransportException, ProtocolException {
        List<RemoteTool> tools = adapter.discover();
        out.println("TOOLS (" + tools.size() + "):");
        for (RemoteTool tool : tools) {
            out.println("  " + tool.signature() + " - " + tool.description());
            for (ToolParameter parameter : tool.parameters()) {
                if (parameter.description() != null) {
                    out.println("      " + parameter.name() + ": " + parameter.description());
                }
            }
        }
    }

    private static int handleCall(ToolAdapter adapter, ObjectMapper mapper, List<String> arguments, PrintStream out,
        PrintStream err) throws TransportException, ProtocolException {
        if (arguments.isEmpty()) {
            err.println("call requires a tool name");
            return 2;
        }
        String toolName = arguments.get(0);
        String json = arguments.size() > 1 ? arguments.get(1) : "{}";
        Map<String, Object> toolArguments;
        try {
            JsonNode parsed = mapper.readTree(json);
            toolArguments = mapper.convertValue(parsed, mapper.getTypeFactory()
                .constructMapType(Map.class, String.class, Object.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            err.println("Arguments must be a JSON object: " + e.getMessage());
            return 2;
        }
        InvocationResult result = adapter.invoke(toolName, toolArguments);
        if (result.isError()) {
            out.println("TOOL ERROR: " + result.joinedText());
            return 1;
        }
        out.println(result.joinedText());
        return 0;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -jar toolrpc-client.jar [--url <endpoint>] [--timeout <seconds>] <command> [args]\n" +
            "Commands:\n" +
            "  init\n" +
            "  list\n" +
            "  call <tool> [json-arguments]");
    }
}
