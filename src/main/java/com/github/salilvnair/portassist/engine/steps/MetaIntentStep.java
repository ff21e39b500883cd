package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.engine.constants.DecisionPathConstants;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.AccessPolicy;
import com.github.salilvnair.portassist.response.MetaResponseBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Answers help, smalltalk and unknown turns locally. Meta intents are public,
 * so this runs ahead of the access policy.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(EntityExtractionStep.class)
public class MetaIntentStep implements EngineStep {

    private final MetaResponseBuilder metaResponseBuilder;
    private final AccessPolicy accessPolicy;

    @Override
    public StepResult execute(EngineSession session) {
        Intent intent = session.intent();
        if (!intent.isMeta()) {
            return new StepResult.Continue();
        }

        switch (intent) {
            case HELP -> {
                session.setOutcome(metaResponseBuilder.help(session.getRole(), accessPolicy.allowedIntents(session.getRole())));
                session.addDecision(DecisionPathConstants.HELP_GENERATED);
            }
            case SMALLTALK -> {
                session.setOutcome(metaResponseBuilder.smalltalk(session.getRole()));
                session.addDecision(DecisionPathConstants.SMALLTALK_REPLIED);
            }
            default -> {
                session.setOutcome(metaResponseBuilder.unknown());
                session.addDecision(DecisionPathConstants.UNKNOWN_INTENT);
            }
        }
        return new StepResult.Continue();
    }
}
