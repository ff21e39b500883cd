package com.github.salilvnair.portassist.dispatch.remote;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.portassist.dispatch.CapabilityHandler;
import com.github.salilvnair.portassist.dispatch.ExecutionContext;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Capability served by another service. The execution context is posted as
 * JSON; a JSON object reply comes back as a map, anything else as text.
 */
@Slf4j
public class RemoteCapabilityHandler implements CapabilityHandler {

    public static final String TRACE_HEADER = "X-Trace-Id";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final URI uri;
    private final RemoteExecutionPolicy policy;
    private final ObjectMapper mapper;
    private final HttpClient client;

    public RemoteCapabilityHandler(String name, String url, RemoteExecutionPolicy policy, ObjectMapper mapper) {
        if (url == null || url.isBlank()) {
            throw new PortAssistException(
                    PortAssistErrorCode.REMOTE_HANDLER_MISCONFIGURED,
                    "Remote capability handler '" + name + "' has no URL configured"
            );
        }
        this.name = name;
        this.uri = URI.create(url.trim());
        this.policy = policy;
        this.mapper = mapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(policy.connectTimeoutMs()))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    public URI uri() {
        return uri;
    }

    @Override
    public Object handle(ExecutionContext context) throws Exception {
        String body = mapper.writeValueAsString(context.toPayload());

        int attempt = 1;
        long backoffMs = policy.initialBackoffMs();

        while (true) {
            try {
                HttpResponse<String> response = client.send(request(context, body), HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return readBody(response.body());
                }
                if (!policy.retryStatusCodes().contains(status) || attempt >= policy.maxAttempts()) {
                    throw new PortAssistException(
                            PortAssistErrorCode.HANDLER_UPSTREAM_STATUS,
                            "Handler " + name + " failed with status " + status + " after " + attempt + " attempt(s)"
                    ).withMetaData(Map.of("status", status, "attempts", attempt));
                }
                log.warn("Handler {} returned status {} on attempt {}, retrying", name, status, attempt);
            }
            catch (IOException io) {
                if (!policy.retryOnIOException() || attempt >= policy.maxAttempts()) {
                    throw new PortAssistException(
                            PortAssistErrorCode.HANDLER_IO_FAILURE,
                            "Handler " + name + " failed due to IO error after " + attempt + " attempt(s)",
                            io
                    );
                }
                log.warn("Handler {} IO error on attempt {}, retrying: {}", name, attempt, io.getMessage());
            }
            catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw new PortAssistException(
                        PortAssistErrorCode.HANDLER_INTERRUPTED,
                        "Handler " + name + " call interrupted",
                        interrupted
                );
            }

            sleep(backoffMs);
            backoffMs = (long) Math.min(policy.maxBackoffMs(), Math.max(1L, Math.round(backoffMs * policy.backoffMultiplier())));
            attempt++;
        }
    }

    private HttpRequest request(ExecutionContext context, String body) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(policy.readTimeoutMs()))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (context.traceId() != null && !context.traceId().isBlank()) {
            request.header(TRACE_HEADER, context.traceId());
        }
        String authHeader = context.authHeader();
        if (authHeader != null && !authHeader.isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, authHeader);
        }
        return request.build();
    }

    private Object readBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return trimmed;
        }
        try {
            return mapper.readValue(trimmed, MAP_TYPE);
        }
        catch (IOException e) {
            throw new PortAssistException(
                    PortAssistErrorCode.HANDLER_INVALID_RESPONSE,
                    "Handler " + name + " returned malformed JSON",
                    e
            );
        }
    }

    private void sleep(long ms) throws InterruptedException {
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
