package com.github.salilvnair.portassist.dispatch;

import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.AccessDecision;

import java.util.Map;

/**
 * Result of routing one turn. Consumed straight away by the response
 * normalizer.
 */
public sealed interface DispatchOutcome
        permits DispatchOutcome.Routed,
                DispatchOutcome.NotImplemented,
                DispatchOutcome.Denied,
                DispatchOutcome.MetaHandled,
                DispatchOutcome.Failed {

    String CONFIGURATION_ERROR = "configuration_error";
    String HANDLER_ERROR = "ModelError";

    record Routed(String handlerName, Object result) implements DispatchOutcome {}

    record NotImplemented(Intent intent) implements DispatchOutcome {}

    record Denied(Intent intent, AccessDecision decision) implements DispatchOutcome {}

    record MetaHandled(Intent intent, String message, Map<String, Object> data) implements DispatchOutcome {}

    record Failed(String handlerName, String kind) implements DispatchOutcome {}
}
