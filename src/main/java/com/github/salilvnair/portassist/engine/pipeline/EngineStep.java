package com.github.salilvnair.portassist.engine.pipeline;

import com.github.salilvnair.portassist.engine.session.EngineSession;

public interface EngineStep {
    StepResult execute(EngineSession session);
}
