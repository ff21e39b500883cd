package com.github.salilvnair.portassist.dispatch;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a capability handler receives for one turn.
 */
public record ExecutionContext(
        String message,
        Intent intent,
        EntityBag entities,
        List<ConversationTurn> history,
        Role role,
        String userId,
        String traceId,
        Map<String, Object> extraContext,
        boolean needsDownstreamOwnershipCheck
) {

    public static final String AUTH_HEADER_KEY = "auth_header";

    public ExecutionContext {
        entities = entities == null ? EntityBag.empty() : entities;
        history = history == null ? List.of() : history.stream().filter(Objects::nonNull).toList();
        extraContext = extraContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraContext));
    }

    public String authHeader() {
        Object value = extraContext.get(AUTH_HEADER_KEY);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * JSON friendly view. The forwarded authorization header is left out.
     */
    public Map<String, Object> toPayload() {
        List<Map<String, Object>> turns = new ArrayList<>();
        for (ConversationTurn turn : history) {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("role", turn.role());
            t.put("content", turn.content());
            t.put("intent", turn.intent());
            turns.add(t);
        }
        Map<String, Object> extra = new LinkedHashMap<>(extraContext);
        extra.remove(AUTH_HEADER_KEY);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("intent", intent == null ? null : intent.code());
        payload.put("entities", entities.asMap());
        payload.put("history", turns);
        payload.put("user_role", role == null ? null : role.name());
        payload.put("user_id", userId);
        payload.put("trace_id", traceId);
        payload.put("extra_context", extra);
        payload.put("needs_downstream_ownership_check", needsDownstreamOwnershipCheck);
        return payload;
    }
}
