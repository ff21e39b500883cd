package com.github.salilvnair.portassist.engine.steps;

import com.github.salilvnair.portassist.engine.constants.DecisionPathConstants;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.entity.EntityExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
@MustRunAfter(IntentResolutionStep.class)
public class EntityExtractionStep implements EngineStep {

    private final EntityExtractor entityExtractor;

    @Override
    public StepResult execute(EngineSession session) {
        EntityBag entities = entityExtractor.extract(session.getUserText(), session.getReferenceDate());
        session.setEntities(entities);
        session.addDecision(DecisionPathConstants.entities(entities.size()));
        return new StepResult.Continue();
    }
}
