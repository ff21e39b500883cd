package com.github.salilvnair.portassist.engine.session;

import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import com.github.salilvnair.portassist.engine.model.StepTiming;
import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.intent.IntentDecision;
import com.github.salilvnair.portassist.policy.AccessDecision;
import com.github.salilvnair.portassist.policy.Role;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Mutable state of a single turn while it moves through the pipeline.
 */
@Getter
@Setter
public class EngineSession {

    private final EngineContext engineContext;
    private final String traceId;
    private final Role role;
    private final LocalDate referenceDate;

    private IntentDecision intentDecision;
    private EntityBag entities = EntityBag.empty();
    private AccessDecision accessDecision;
    private DispatchOutcome outcome;
    private NormalizedResponse finalResult;

    private final List<String> decisionPath = new ArrayList<>();
    private final List<StepTiming> stepTimings = new ArrayList<>();

    public EngineSession(EngineContext engineContext, LocalDate referenceDate) {
        this.engineContext = engineContext;
        this.referenceDate = referenceDate;
        this.traceId = engineContext.getTraceId() == null || engineContext.getTraceId().isBlank()
                ? UUID.randomUUID().toString()
                : engineContext.getTraceId().trim();
        this.role = Role.normalize(engineContext.getUserRole());
    }

    public String getUserText() {
        return engineContext.getUserText();
    }

    /**
     * Prior turns, null entries dropped.
     */
    public List<ConversationTurn> history() {
        return engineContext.getHistory() == null
                ? Collections.emptyList()
                : engineContext.getHistory().stream().filter(Objects::nonNull).toList();
    }

    public Intent intent() {
        return intentDecision == null ? Intent.UNKNOWN : intentDecision.intent();
    }

    public boolean hasOutcome() {
        return outcome != null;
    }

    public void addDecision(String token) {
        decisionPath.add(token);
    }

    /**
     * Trace prefix used in log lines.
     */
    public String shortTraceId() {
        return traceId.length() > 8 ? traceId.substring(0, 8) : traceId;
    }
}
