package com.github.salilvnair.portassist.engine.core;

import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.response.NormalizedResponse;

public interface OrchestrationEngine {
    NormalizedResponse process(EngineContext engineContext);
}
