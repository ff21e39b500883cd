package com.github.salilvnair.portassist.engine.pipeline;

import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.response.NormalizedResponse;

import java.util.List;

public final class EnginePipeline {

    private final List<EngineStep> steps;

    public EnginePipeline(List<EngineStep> steps) {
        this.steps = steps;
    }

    public NormalizedResponse execute(EngineSession session) {
        for (EngineStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // ResponseResolutionStep must have set finalResult
        if (session.getFinalResult() == null) {
            throw new PortAssistException(
                    PortAssistErrorCode.PIPELINE_NO_FINAL_RESULT
            );
        }
        return session.getFinalResult();
    }

    public List<EngineStep> steps() {
        return steps;
    }
}
