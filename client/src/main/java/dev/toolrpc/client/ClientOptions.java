package dev.toolrpc.client;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Connection settings of the console client.
 * @param endpoint protocol endpoint URL
 * @param requestTimeout how long to wait for each response
 * @param connectTimeout how long to wait for a connection
 */
public record ClientOptions(URI endpoint, Duration requestTimeout, Duration connectTimeout) {

    public static final String URL_ENV = "TOOLRPC_URL";
    public static final URI DEFAULT_ENDPOINT = URI.create("http://localhost:8080/mcp");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Resolve options, consuming {@code --url <url>} and {@code --timeout <seconds>} from the
     * argument list. The URL falls back to {@value #URL_ENV}, then to the local default.
     * @param arguments mutable command line arguments
     * @param environment process environment
     * @return resolved options
     */
    public static ClientOptions resolve(List<String> arguments, Map<String, String> environment) {
        URI endpoint = null;
        Duration timeout = DEFAULT_TIMEOUT;
        Iterator<String> iterator = arguments.iterator();
        while (iterator.hasNext()) {
            String argument = iterator.next();
            if ("--url".equals(argument) || "--timeout".equals(argument)) {
                iterator.remove();
                if (!iterator.hasNext()) {
                    throw new IllegalArgumentException(argument + " requires a value");
                }
                String value = iterator.next();
                iterator.remove();
                if ("--url".equals(argument)) {
                    endpoint = URI.create(value);
                } else {
                    timeout = Duration.ofSeconds(Long.parseLong(value));
                }
            }
        }
        if (endpoint == null) {
            String fromEnvironment = environment.get(URL_ENV);
            endpoint = fromEnvironment == null || fromEnvironment.isBlank() ? DEFAULT_ENDPOINT : URI.create(fromEnvironment);
        }
        return new ClientOptions(endpoint, timeout, Duration.ofSeconds(10));
    }
}
