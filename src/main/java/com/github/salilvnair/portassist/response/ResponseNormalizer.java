package com.github.salilvnair.portassist.response;

import com.github.salilvnair.portassist.config.PortAssistConfig;
import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.engine.constants.ProofKeyConstants;
import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.AccessDecision;
import com.github.salilvnair.portassist.policy.Role;
import com.github.salilvnair.portassist.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces whatever a handler produced, or whatever the pipeline decided, into
 * a {@link NormalizedResponse} and stamps the trace proofs.
 */
@RequiredArgsConstructor
@Component
public class ResponseNormalizer {

    public static final String UNAUTHENTICATED_MESSAGE = "Authentication required for this feature.";
    public static final String HANDLER_FAILURE_MESSAGE =
            "I encountered an error processing your request. Please try again.";
    public static final String UNEXPECTED_FAILURE_MESSAGE =
            "I encountered an unexpected error. Please try again or contact support.";

    public static final String OUTCOME_DENIED = "denied";
    public static final String OUTCOME_FORBIDDEN = "forbidden";
    public static final String OUTCOME_NOT_IMPLEMENTED = "not_implemented";

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern IPV4 = Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b");
    private static final Pattern FILE_PATH = Pattern.compile("(?:[A-Za-z]:\\\\|/)\\S+");
    private static final Pattern SQL = Pattern.compile(
            "\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE)\\b.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final PortAssistConfig config;
    private final Clock clock;

    // ---------------------------------------------------------------------
    // Outcome rendering
    // ---------------------------------------------------------------------
    public NormalizedResponse fromOutcome(DispatchOutcome outcome, ResponseContext ctx) {
        if (outcome instanceof DispatchOutcome.Routed routed) {
            return normalize(routed.result(), ctx.traceId(), ctx.decisionPath(), ctx.intent().code());
        }
        if (outcome instanceof DispatchOutcome.MetaHandled meta) {
            return success(meta.message(), meta.data(), ctx.traceId(), ctx.decisionPath(), meta.intent().code());
        }
        if (outcome instanceof DispatchOutcome.NotImplemented notImplemented) {
            return notImplemented(notImplemented.intent(), ctx);
        }
        if (outcome instanceof DispatchOutcome.Denied denied) {
            return denied(denied.intent(), denied.decision(), ctx);
        }
        DispatchOutcome.Failed failed = (DispatchOutcome.Failed) outcome;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error_type", failed.kind());
        return build(HANDLER_FAILURE_MESSAGE, data, null, ResponseStatus.FAILED, ctx.traceId(), ctx.decisionPath(), ctx.intent().code());
    }

    private NormalizedResponse notImplemented(Intent intent, ResponseContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planned_intent", intent.code());
        data.put("entities", ctx.entities().asMap());
        data.put("suggestion", "Please check back later or contact support.");
        return build(
                "The '" + intent.code() + "' feature is planned but not yet implemented. It will be available soon!",
                data,
                null,
                ResponseStatus.OK,
                ctx.traceId(),
                ctx.decisionPath(),
                OUTCOME_NOT_IMPLEMENTED
        );
    }

    private NormalizedResponse denied(Intent intent, AccessDecision decision, ResponseContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requested_intent", intent.code());
        data.put("status_code", decision.httpStatus());
        data.put("reason", decision.code() == null ? null : decision.code().value());
        if (decision.httpStatus() == AccessDecision.STATUS_UNAUTHORIZED) {
            data.put("error", "Unauthorized");
            return build(UNAUTHENTICATED_MESSAGE, data, null, ResponseStatus.FAILED,
                    ctx.traceId(), ctx.decisionPath(), OUTCOME_DENIED);
        }
        String role = ctx.role().name();
        data.put("error", "Forbidden");
        data.put("user_role", role);
        data.put("required_role", decision.requiredRole());
        data.put("allowed_intents", ctx.allowedIntents());
        return build(
                "Sorry, the '" + intent.code() + "' feature is not available for your role (" + role + ").",
                data,
                null,
                ResponseStatus.FAILED,
                ctx.traceId(),
                ctx.decisionPath(),
                OUTCOME_FORBIDDEN
        );
    }

    // ---------------------------------------------------------------------
    // Raw handler output
    // ---------------------------------------------------------------------
    public NormalizedResponse normalize(Object raw, String traceId, List<String> decisionPath) {
        return normalize(raw, traceId, decisionPath, null);
    }

    private NormalizedResponse normalize(Object raw, String traceId, List<String> decisionPath, String intentTag) {
        if (raw instanceof NormalizedResponse already) {
            return build(already.message(), already.data(), already.proofs(), ResponseStatus.OK, traceId, decisionPath, intentTag);
        }
        if (raw == null) {
            return build("Operation completed", null, null, ResponseStatus.OK, traceId, decisionPath, intentTag);
        }
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean) {
            return build(String.valueOf(raw), null, null, ResponseStatus.OK, traceId, decisionPath, intentTag);
        }

        Map<String, Object> map = raw instanceof Map<?, ?> m
                ? stringKeys(m)
                : JsonUtil.toMapOrNull(raw);
        if (map == null) {
            return build(String.valueOf(raw), null, null, ResponseStatus.OK, traceId, decisionPath, intentTag);
        }

        Map<String, Object> proofs = map.get("proofs") instanceof Map<?, ?> p ? stringKeys(p) : null;

        if (map.containsKey("message") && map.containsKey("data")) {
            return build(asText(map.get("message")), map.get("data"), proofs, ResponseStatus.OK, traceId, decisionPath, intentTag);
        }

        if (map.get("ok") instanceof Boolean ok) {
            if (ok) {
                Object result = map.get("result");
                String message = result instanceof Map<?, ?> r ? deriveMessage(stringKeys(r)) : null;
                return build(message == null ? "Operation completed successfully" : message,
                        result, proofs, ResponseStatus.OK, traceId, decisionPath, intentTag);
            }
            Map<String, Object> error = map.get("error") instanceof Map<?, ?> e ? stringKeys(e) : Map.of();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("error_type", error.getOrDefault("type", DispatchOutcome.HANDLER_ERROR));
            return build(HANDLER_FAILURE_MESSAGE, data, proofs, ResponseStatus.FAILED, traceId, decisionPath, intentTag);
        }

        if (map.containsKey("message")) {
            Map<String, Object> data = new LinkedHashMap<>(map);
            data.remove("message");
            data.remove("proofs");
            return build(asText(map.get("message")), data, proofs, ResponseStatus.OK, traceId, decisionPath, intentTag);
        }

        String message = deriveMessage(map);
        return build(message == null ? "Operation completed" : message, map, null, ResponseStatus.OK, traceId, decisionPath, intentTag);
    }

    /**
     * First of message, summary, description and explanation; otherwise a
     * line built from a score/tier pair, a recommendation list or a risk
     * score. Null when none applies.
     */
    public String deriveMessage(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        for (String field : List.of("message", "summary", "description", "explanation")) {
            if (data.get(field) instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        if (data.get("score") instanceof Number score && data.containsKey("tier")) {
            return String.format(Locale.ROOT, "Score: %.1f/100 (Tier %s)", score.doubleValue(), data.get("tier"));
        }
        if (data.get("recommended") instanceof List<?> recommended) {
            int count = recommended.size();
            return "Found " + count + " recommended slot" + (count == 1 ? "" : "s");
        }
        if (data.get("risk_score") instanceof Number risk) {
            return String.format(Locale.ROOT, "Risk score: %.2f", risk.doubleValue());
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Builders
    // ---------------------------------------------------------------------
    public NormalizedResponse success(String message, Object data, String traceId, List<String> decisionPath) {
        return success(message, data, traceId, decisionPath, null);
    }

    private NormalizedResponse success(String message, Object data, String traceId, List<String> decisionPath, String intentTag) {
        return build(message, data, null, ResponseStatus.OK, traceId, decisionPath, intentTag);
    }

    public NormalizedResponse failure(String message, String errorType, String traceId, List<String> decisionPath) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error_type", errorType);
        return build(sanitize(message), data, null, ResponseStatus.FAILED, traceId, decisionPath, null);
    }

    public NormalizedResponse validationError(String message, String missingField, String example, String suggestion,
                                              String traceId, List<String> decisionPath) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", "ValidationError");
        data.put("missing_field", missingField);
        data.put("example", example);
        data.put("suggestion", suggestion);
        return build(message, data, null, ResponseStatus.VALIDATION_FAILED, traceId, decisionPath, null);
    }

    /**
     * Masks URLs, IPv4 addresses, file paths and SQL fragments.
     */
    public static String sanitize(String message) {
        if (message == null) {
            return null;
        }
        String safe = URL.matcher(message).replaceAll("[URL]");
        safe = IPV4.matcher(safe).replaceAll("[IP]");
        safe = FILE_PATH.matcher(safe).replaceAll("[PATH]");
        return SQL.matcher(safe).replaceAll("[SQL]");
    }

    private NormalizedResponse build(String message,
                                     Object data,
                                     Map<String, Object> existingProofs,
                                     ResponseStatus status,
                                     String traceId,
                                     List<String> decisionPath,
                                     String intentTag) {
        Map<String, Object> proofs = existingProofs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existingProofs);
        if (traceId != null) {
            proofs.putIfAbsent(ProofKeyConstants.TRACE_ID, traceId);
        }
        proofs.putIfAbsent(ProofKeyConstants.STATUS, status.value());
        proofs.putIfAbsent(ProofKeyConstants.COMPONENT, config.getResponse().getComponent());
        proofs.putIfAbsent(ProofKeyConstants.TIMESTAMP, Instant.now(clock).toString());
        if (intentTag != null) {
            proofs.putIfAbsent(ProofKeyConstants.INTENT, intentTag);
        }

        List<Object> trail = new ArrayList<>();
        if (proofs.get(ProofKeyConstants.DECISION_PATH) instanceof List<?> existing) {
            trail.addAll(existing);
        }
        if (decisionPath != null) {
            trail.addAll(decisionPath);
        }
        proofs.put(ProofKeyConstants.DECISION_PATH, trail);

        return new NormalizedResponse(message, data, proofs);
    }

    private Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    /**
     * What the outcome renderer needs besides the outcome itself.
     */
    public record ResponseContext(
            Intent intent,
            Role role,
            List<String> allowedIntents,
            EntityBag entities,
            String traceId,
            List<String> decisionPath
    ) {
        public ResponseContext {
            allowedIntents = allowedIntents == null ? List.of() : List.copyOf(allowedIntents);
            entities = entities == null ? EntityBag.empty() : entities;
            decisionPath = decisionPath == null ? List.of() : List.copyOf(decisionPath);
        }
    }
}
