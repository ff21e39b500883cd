package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.engine.constants.DecisionPathConstants;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.intent.CompositeIntentResolver;
import com.github.salilvnair.portassist.intent.IntentDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class IntentResolutionStep implements EngineStep {

    private final CompositeIntentResolver intentResolver;

    @Override
    public StepResult execute(EngineSession session) {
        IntentDecision decision = intentResolver.resolve(session.getUserText(), session.history());
        session.setIntentDecision(decision);

        String code = decision.intent().code();
        session.addDecision(DecisionPathConstants.intent(code));
        if (decision.source() == IntentDecision.Source.FOLLOW_UP) {
            session.addDecision(DecisionPathConstants.followUp(code));
        }

        log.debug("[{}] intent={} confidence={} rules={}",
                session.shortTraceId(), code, decision.confidence(), decision.matchedRules());
        return new StepResult.Continue();
    }
}
