package com.github.salilvnair.portassist.engine.pipeline;

import com.github.salilvnair.portassist.response.NormalizedResponse;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(NormalizedResponse result) implements StepResult {}
}
