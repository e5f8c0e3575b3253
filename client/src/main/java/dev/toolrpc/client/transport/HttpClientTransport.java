package dev.toolrpc.client.transport;

import dev.toolrpc.protocol.Protocol;
import dev.toolrpc.transport.DecodeException;
import dev.toolrpc.transport.Envelope;
import dev.toolrpc.transport.EnvelopeCodec;
import dev.toolrpc.transport.Wire;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one request envelope per HTTP POST and returns the matching response envelope. Remembers
 * the session id the server hands out and sends it back on every later call.
 */
public class HttpClientTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

    private final URI endpoint;
    private final HttpClient httpClient;
    private final EnvelopeCodec codec;
    private final String peer;

    private volatile String sessionId;

    public HttpClientTransport(URI endpoint, Duration connectTimeout) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(connectTimeout).build(), new EnvelopeCodec());
    }

    public HttpClientTransport(URI endpoint, HttpClient httpClient, EnvelopeCodec codec) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.peer = endpoint.getHost() + ":" + endpoint.getPort();
    }

    public URI endpoint() {
        return endpoint;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Exchange one envelope.
     * @param request request envelope
     * @param timeout how long to wait for the response
     * @return the response envelope, whose id matches the request id (or is {@code null} for an
     * error the server could not correlate)
     * @throws TransportException on timeout, connection failure or malformed response
     */
    public Envelope send(Envelope request, Duration timeout) throws TransportException {
        String json = codec.toJson(request);
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        String currentSession = sessionId;
        if (currentSession != null) {
            builder.header(Protocol.SESSION_HEADER, currentSession);
        }

        Wire.tx(peer, request, json);
        CompletableFuture<HttpResponse<byte[]>> future =
            httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response = await(future, request, timeout);

        response.headers().firstValue(Protocol.SESSION_HEADER).ifPresent(id -> sessionId = id);
        Envelope envelope;
        try {
            envelope = codec.decode(response.body());
        } catch (DecodeException e) {
            throw new TransportException(TransportException.Kind.MALFORMED,
                "Malformed response to " + request.method() + " (HTTP " + response.statusCode() + "): " + e.getMessage(), e);
        }
        Wire.rx(peer, envelope, new String(response.body(), StandardCharsets.UTF_8));
        if (envelope.isRequest()) {
            throw new TransportException(TransportException.Kind.MALFORMED,
                "Expected a response to " + request.id() + " but received request " + envelope.method());
        }
        if (envelope.id() != null && !envelope.id().equals(request.id())) {
            throw new TransportException(TransportException.Kind.MALFORMED,
                "Response id " + envelope.id() + " does not match request id " + request.id());
        }
        return envelope;
    }

    private HttpResponse<byte[]> await(CompletableFuture<HttpResponse<byte[]>> future, Envelope request,
        Duration timeout) throws TransportException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.whenComplete((late, error) ->
                LOGGER.debug("Discarded late outcome of request {} ({})", request.id(), request.method()));
            throw new TransportException(TransportException.Kind.TIMEOUT,
                "No response to " + request.method() + " (id=" + request.id() + ") within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransportException(TransportException.Kind.UNREACHABLE,
                "Interrupted while waiting for " + request.method(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TransportException(TransportException.Kind.TIMEOUT,
                    "No response to " + request.method() + " (id=" + request.id() + ") within " + timeout, cause);
            }
            throw new TransportException(TransportException.Kind.UNREACHABLE,
                "Failed to reach " + endpoint + ": " + cause, cause);
        }
    }

    /**
     * Ask the server to close the current session, if there is one.
     * @param timeout how long to wait for the server
     * @throws TransportException when the server cannot be reached
     */
    public void terminateSession(Duration timeout) throws TransportException {
        String currentSession = sessionId;
        if (currentSession == null) {
            return;
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header(Protocol.SESSION_HEADER, currentSession)
            .DELETE()
            .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            LOGGER.info("Session {} terminated (HTTP {})", currentSession, response.statusCode());
        } catch (HttpTimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT, "Session termination timed out", e);
        } catch (IOException e) {
            throw new TransportException(TransportException.Kind.UNREACHABLE, "Failed to reach " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.UNREACHABLE, "Interrupted while terminating session", e);
        } finally {
            sessionId = null;
        }
    }
}
