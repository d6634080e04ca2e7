package fr.lapetina.inferencebench.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inferencebench.domain.model.ErrorType;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * JSON-over-HTTP transport shared by the backend adapters.
 *
 * Uses java.net.http.HttpClient. Every call runs under a child of the caller's
 * {@link CallContext} bounded by the request timeout; cancelling the context aborts
 * the exchange, including a response body still being read.
 */
public class JsonHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public JsonHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = createObjectMapper();
    }

    public JsonHttpClient() {
        this(Duration.ofSeconds(10), Duration.ofMinutes(10));
    }

    /**
     * The mapper configuration used for every wire document.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Sends a GET and reads the whole body.
     */
    public Result get(CallContext ctx, URI uri, String operation) {
        return send(ctx, HttpRequest.newBuilder().uri(uri).GET(), operation);
    }

    /**
     * Sends a JSON POST and reads the whole body.
     */
    public Result post(CallContext ctx, URI uri, Object payload, String operation) {
        return send(ctx, jsonPost(uri, payload, operation), operation);
    }

    /**
     * Sends a JSON POST and returns as soon as the status line and headers arrive.
     * The caller reads the body line by line and must close the returned stream.
     *
     * @param accept value of the Accept header, or null for none
     */
    public Streaming openStream(CallContext ctx, URI uri, Object payload, String accept, String operation) {
        HttpRequest.Builder builder = jsonPost(uri, payload, operation);
        if (accept != null) {
            builder.header("Accept", accept);
        }
        CallContext call = ctx.withTimeout(requestTimeout);
        try {
            call.throwIfDone(operation);
            log.debug("Opening stream: operation={}, uri={}", operation, uri);
            CompletableFuture<HttpResponse<InputStream>> future =
                    httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            HttpResponse<InputStream> response = await(call, future, operation);
            return new Streaming(call, response.statusCode(), response.body(), operation);
        } catch (RuntimeException e) {
            call.close();
            throw e;
        }
    }

    private Result send(CallContext ctx, HttpRequest.Builder builder, String operation) {
        try (CallContext call = ctx.withTimeout(requestTimeout)) {
            call.throwIfDone(operation);
            HttpRequest request = builder.build();
            log.debug("Sending request: operation={}, method={}, uri={}", operation, request.method(), request.uri());
            HttpResponse<String> response = await(call,
                    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)),
                    operation);
            log.debug("Response received: operation={}, status={}", operation, response.statusCode());
            return new Result(response.statusCode(), response.body());
        }
    }

    private HttpRequest.Builder jsonPost(URI uri, Object payload, String operation) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorType.INTERNAL_ERROR, operation + ": failed to encode request", e);
        }
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
    }

    private <T> T await(CallContext call, CompletableFuture<T> future, String operation) {
        try (CallContext.Registration ignored = call.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (CancellationException e) {
            throw call.doneException(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ProviderException(ErrorType.CANCELLED, operation + ": interrupted", e);
        } catch (ExecutionException e) {
            if (call.isDone()) {
                throw call.doneException(operation, e.getCause());
            }
            throw classify(e.getCause(), operation);
        }
    }

    /**
     * Maps a transport failure onto the error taxonomy.
     */
    static ProviderException classify(Throwable cause, String operation) {
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        String message = operation + ": " + cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
            return new ProviderException(ErrorType.TRANSPORT_ERROR, message, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new ProviderException(ErrorType.TIMEOUT, message, cause);
        }
        if (cause instanceof IOException) {
            return new ProviderException(ErrorType.TRANSPORT_ERROR, message, cause);
        }
        return new ProviderException(ErrorType.INTERNAL_ERROR, message, cause);
    }

    /**
     * Parses a body as JSON, reporting malformed documents as protocol errors.
     */
    public JsonNode parse(String body, String operation) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorType.PROTOCOL_ERROR,
                    operation + ": malformed JSON response: " + e.getOriginalMessage(),
                    ProviderException.NO_STATUS, body, e);
        }
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }

    /**
     * A fully read response.
     */
    public record Result(int statusCode, String body) {
        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    /**
     * An open response whose body is consumed incrementally.
     */
    public static final class Streaming implements AutoCloseable {

        private final CallContext call;
        private final int statusCode;
        private final InputStream body;
        private final BufferedReader reader;
        private final String operation;
        private final CallContext.Registration abortOnCancel;

        private Streaming(CallContext call, int statusCode, InputStream body, String operation) {
            this.call = call;
            this.statusCode = statusCode;
            this.body = body;
            this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
            this.operation = operation;
            this.abortOnCancel = call.onCancel(this::closeBody);
        }

        public int statusCode() {
            return statusCode;
        }

        /**
         * Reads the next line, or null at the end of the body.
         *
         * @throws ProviderException if the read fails or the call was cancelled or timed out
         */
        public String readLine() {
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                call.throwIfDone(operation);
                throw new ProviderException(ErrorType.TRANSPORT_ERROR, operation + ": stream read failed: " + e.getMessage(), e);
            }
            if (line == null) {
                call.throwIfDone(operation);
            }
            return line;
        }

        /**
         * Reads the rest of the body as a string.
         */
        public String readBody() {
            try {
                StringWriter text = new StringWriter();
                reader.transferTo(text);
                call.throwIfDone(operation);
                return text.toString();
            } catch (IOException e) {
                call.throwIfDone(operation);
                throw new ProviderException(ErrorType.TRANSPORT_ERROR, operation + ": body read failed: " + e.getMessage(), e);
            }
        }

        private void closeBody() {
            try {
                body.close();
            } catch (IOException e) {
                log.debug("Error closing response body: operation={}", operation, e);
            }
        }

        @Override
        public void close() {
            abortOnCancel.close();
            closeBody();
            call.close();
        }
    }
}
