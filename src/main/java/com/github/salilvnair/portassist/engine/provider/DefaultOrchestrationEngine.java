package com.github.salilvnair.portassist.engine.provider;

import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.core.OrchestrationEngine;
import com.github.salilvnair.portassist.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@RequiredArgsConstructor
@Component
public class DefaultOrchestrationEngine implements OrchestrationEngine {

    private final EnginePipelineFactory pipelineFactory;
    private final Clock clock;

    @Override
    public NormalizedResponse process(EngineContext engineContext) {
        EngineSession session = new EngineSession(engineContext, LocalDate.now(clock));
        return pipelineFactory.create().execute(session);
    }
}
