package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.dispatch.DispatchRouter;
import com.github.salilvnair.portassist.dispatch.ExecutionContext;
import com.github.salilvnair.portassist.engine.constants.DecisionPathConstants;
import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
@MustRunAfter(AccessPolicyStep.class)
public class DispatchStep implements EngineStep {

    private final DispatchRouter router;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.hasOutcome()) {
            return new StepResult.Continue();
        }

        EngineContext ctx = session.getEngineContext();
        ExecutionContext executionContext = new ExecutionContext(
                session.getUserText(),
                session.intent(),
                session.getEntities(),
                session.history(),
                session.getRole(),
                ctx.getUserId(),
                session.getTraceId(),
                ctx.getExtraContext(),
                session.getAccessDecision() != null && session.getAccessDecision().needsDownstreamOwnershipCheck()
        );

        DispatchOutcome outcome = router.dispatch(session.intent(), executionContext);
        session.setOutcome(outcome);

        if (outcome instanceof DispatchOutcome.Routed routed) {
            session.addDecision(DecisionPathConstants.agent(routed.handlerName()));
            session.addDecision(DecisionPathConstants.AGENT_EXECUTED);
        }
        else if (outcome instanceof DispatchOutcome.Failed failed) {
            session.addDecision(DecisionPathConstants.agent(failed.handlerName()));
            session.addDecision(DecisionPathConstants.agentFailed(failed.kind()));
        }
        else {
            session.addDecision(DecisionPathConstants.AGENT_NOT_IMPLEMENTED);
        }
        return new StepResult.Continue();
    }
}
