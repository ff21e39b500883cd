package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.engine.constants.DecisionPathConstants;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.entity.EntityKeyConstants;
import com.github.salilvnair.portassist.policy.AccessDecision;
import com.github.salilvnair.portassist.policy.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(MetaIntentStep.class)
public class AccessPolicyStep implements EngineStep {

    private final AccessPolicy accessPolicy;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.hasOutcome()) {
            return new StepResult.Continue();
        }

        Object ownCarrier = session.getEngineContext().getExtraContext().get(EntityKeyConstants.CARRIER_ID);
        AccessDecision decision = accessPolicy.evaluate(
                session.intent(),
                session.getRole(),
                session.getEngineContext().isAuthPresent(),
                session.getEntities(),
                ownCarrier == null ? null : String.valueOf(ownCarrier)
        );
        session.setAccessDecision(decision);

        if (!decision.allowed()) {
            log.warn("[{}] Access denied: intent={} role={} status={} reason={}",
                    session.shortTraceId(), session.intent().code(), session.getRole(),
                    decision.httpStatus(), decision.code().value());
            session.addDecision(DecisionPathConstants.RBAC_DENIED);
            session.setOutcome(new DispatchOutcome.Denied(session.intent(), decision));
            return new StepResult.Continue();
        }

        session.addDecision(DecisionPathConstants.RBAC_GRANTED);
        if (decision.needsDownstreamOwnershipCheck()) {
            session.addDecision(DecisionPathConstants.OWNERSHIP_DEFERRED);
        }
        return new StepResult.Continue();
    }
}
