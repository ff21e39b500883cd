package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import com.github.salilvnair.portassist.response.ResponseNormalizer;
import com.github.salilvnair.portassist.policy.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@TerminalStep
public class ResponseResolutionStep implements EngineStep {

    private final ResponseNormalizer normalizer;
    private final AccessPolicy accessPolicy;

    @Override
    public StepResult execute(EngineSession session) {
        DispatchOutcome outcome = session.hasOutcome()
                ? session.getOutcome()
                : new DispatchOutcome.NotImplemented(session.intent());

        ResponseNormalizer.ResponseContext responseContext = new ResponseNormalizer.ResponseContext(
                session.intent(),
                session.getRole(),
                accessPolicy.allowedIntents(session.getRole()),
                session.getEntities(),
                session.getTraceId(),
                session.getDecisionPath()
        );

        NormalizedResponse result = normalizer.fromOutcome(outcome, responseContext);
        session.setFinalResult(result);

        log.info("[{}] intent={} role={} outcome={}",
                session.shortTraceId(), session.intent().code(), session.getRole(), outcome.getClass().getSimpleName());
        return new StepResult.Stop(result);
    }
}
