package com.github.salilvnair.portassist.dispatch;

/**
 * A business capability the orchestrator routes to. Implementations are
 * Spring beans registered by {@link #name()}; routes map intents to names.
 * <p>
 * {@link #handle(ExecutionContext)} may return a plain value, a
 * {@link java.util.concurrent.CompletionStage} or a
 * {@link java.util.concurrent.Future}; the router waits for completion.
 */
public interface CapabilityHandler {

    String name();

    Object handle(ExecutionContext context) throws Exception;
}
