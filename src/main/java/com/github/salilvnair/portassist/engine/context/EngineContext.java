package com.github.salilvnair.portassist.engine.context;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Inbound turn as received from transport. Never mutated by the pipeline.
 */
@Value
@Builder
public class EngineContext {
    String userText;
    @Singular("turn")
    List<ConversationTurn> history;
    String userRole;
    String userId;
    String traceId;
    boolean authPresent;
    @Singular("extra")
    Map<String, Object> extraContext;
}
