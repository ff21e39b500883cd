package com.github.salilvnair.portassist.dispatch;

import com.github.salilvnair.portassist.intent.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Hands an authorized intent to its capability handler. The only place where
 * handler exceptions are caught; callers always get a {@link DispatchOutcome}.
 * <p>
 * A result of the shape {@code {ok: false, error: {...}}} is a failure too: the
 * error map is logged and only its {@code type} reaches the caller.
 * <p>
 * Besides exceptions, {@link LinkageError} and {@link StackOverflowError} are
 * contained since they stay local to the failing handler. Other errors such as
 * {@link OutOfMemoryError} leave the JVM in an unknown state and propagate.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DispatchRouter {

    private final CapabilityRegistry registry;

    public DispatchOutcome dispatch(Intent intent, ExecutionContext context) {
        Optional<String> route = registry.handlerNameFor(intent);
        if (route.isEmpty()) {
            return new DispatchOutcome.NotImplemented(intent);
        }

        String handlerName = route.get();
        Optional<CapabilityHandler> handler = registry.handler(handlerName);
        if (handler.isEmpty()) {
            log.error("[{}] No capability handler registered under '{}' for intent {}",
                    context.traceId(), handlerName, intent);
            return new DispatchOutcome.Failed(handlerName, DispatchOutcome.CONFIGURATION_ERROR);
        }

        try {
            Object result = await(handler.get().handle(context));
            Map<String, Object> error = errorShape(result);
            if (error != null) {
                log.error("[{}] Capability handler '{}' reported an error for intent {}: {}",
                        context.traceId(), handlerName, intent, error);
                return new DispatchOutcome.Failed(handlerName, errorKind(error));
            }
            return new DispatchOutcome.Routed(handlerName, result);
        }
        catch (Exception | LinkageError | StackOverflowError e) {
            Throwable root = unwrap(e);
            if (root instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[{}] Capability handler '{}' failed for intent {}", context.traceId(), handlerName, intent, root);
            return new DispatchOutcome.Failed(handlerName, root.getClass().getSimpleName());
        }
    }

    private Object await(Object result) throws ExecutionException, InterruptedException {
        if (result instanceof CompletionStage<?> stage) {
            return stage.toCompletableFuture().get();
        }
        if (result instanceof Future<?> future) {
            return future.get();
        }
        return result;
    }

    /**
     * The error map of an {@code ok: false} result, empty when the handler
     * gave no details; null for any other result.
     */
    static Map<String, Object> errorShape(Object result) {
        if (!(result instanceof Map<?, ?> map) || !Boolean.FALSE.equals(map.get("ok"))) {
            return null;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        if (map.get("error") instanceof Map<?, ?> details) {
            details.forEach((k, v) -> error.put(String.valueOf(k), v));
        }
        else if (map.get("error") != null) {
            error.put("message", map.get("error"));
        }
        return error;
    }

    private static String errorKind(Map<String, Object> error) {
        Object type = error.get("type");
        return type == null || String.valueOf(type).isBlank() ? DispatchOutcome.HANDLER_ERROR : String.valueOf(type);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
