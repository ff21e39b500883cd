package com.github.salilvnair.portassist.engine.factory;

import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.engine.pipeline.EnginePipeline;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.portassist.support.TestConstants.BOOM;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_HELP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnginePipelineFactoryTest {

    @Test
    void initBuildsDagOrderedPipeline() {
        List<String> calls = new ArrayList<>();
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new FinalAnnotatedStep(calls),
                new SecondAnnotatedStep(calls),
                new FirstAnnotatedStep(calls)
        ));

        factory.init();
        EnginePipeline pipeline = factory.create();
        EngineSession session = newSession();
        NormalizedResponse result = pipeline.execute(session);

        assertEquals(List.of("first", "second", "terminal"), calls);
        assertEquals("terminal", result.message());
        assertEquals(3, session.getStepTimings().size());
        assertTrue(session.getStepTimings().stream().allMatch(t -> t.isSuccess()));
    }

    @Test
    void initThrowsWhenNoTerminalStepExists() {
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(new FirstAnnotatedStep(new ArrayList<>())));

        PortAssistException ex = assertThrows(PortAssistException.class, factory::init);
        assertEquals(PortAssistErrorCode.MISSING_TERMINAL_STEP.name(), ex.getErrorCode());
    }

    @Test
    void initThrowsWhenADependencyIsMissing() {
        List<String> calls = new ArrayList<>();
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new SecondAnnotatedStep(calls),
                new FinalAnnotatedStep(calls)
        ));

        PortAssistException ex = assertThrows(PortAssistException.class, factory::init);
        assertEquals(PortAssistErrorCode.MISSING_DEPENDENT_STEP.name(), ex.getErrorCode());
    }

    @Test
    void initThrowsOnDuplicateStepBeans() {
        List<String> calls = new ArrayList<>();
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new FirstAnnotatedStep(calls),
                new FirstAnnotatedStep(calls),
                new FinalAnnotatedStep(calls)
        ));

        PortAssistException ex = assertThrows(PortAssistException.class, factory::init);
        assertEquals(PortAssistErrorCode.DUPLICATE_ENGINE_STEP.name(), ex.getErrorCode());
    }

    @Test
    void initThrowsOnCycle() {
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new CycleLeftStep(),
                new CycleRightStep(),
                new FinalAnnotatedStep(new ArrayList<>())
        ));

        PortAssistException ex = assertThrows(PortAssistException.class, factory::init);
        assertEquals(PortAssistErrorCode.STEP_DAG_CYCLE.name(), ex.getErrorCode());
    }

    @Test
    void failingStepIsTimedAndRethrown() {
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(
                new ExplodingStep(),
                new FinalAnnotatedStep(new ArrayList<>())
        ));
        factory.init();
        EngineSession session = newSession();

        assertThrows(IllegalStateException.class, () -> factory.create().execute(session));
        assertEquals(1, session.getStepTimings().size());
        assertFalse(session.getStepTimings().get(0).isSuccess());
        assertTrue(session.getStepTimings().get(0).getError().contains(BOOM));
    }

    private EngineSession newSession() {
        return new EngineSession(EngineContext.builder()
                .userText(USER_TEXT_HELP)
                .build(), LocalDate.of(2026, 3, 10));
    }

    private static final class FirstAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private FirstAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(EngineSession session) {
            calls.add("first");
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(FirstAnnotatedStep.class)
    private static final class SecondAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private SecondAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(EngineSession session) {
            calls.add("second");
            return new StepResult.Continue();
        }
    }

    @TerminalStep
    private static final class FinalAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private FinalAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(EngineSession session) {
            calls.add("terminal");
            NormalizedResponse result = new NormalizedResponse("terminal", null, Map.of());
            session.setFinalResult(result);
            return new StepResult.Stop(result);
        }
    }

    @MustRunAfter(CycleRightStep.class)
    private static final class CycleLeftStep implements EngineStep {
        @Override
        public StepResult execute(EngineSession session) {
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(CycleLeftStep.class)
    private static final class CycleRightStep implements EngineStep {
        @Override
        public StepResult execute(EngineSession session) {
            return new StepResult.Continue();
        }
    }

    private static final class ExplodingStep implements EngineStep {
        @Override
        public StepResult execute(EngineSession session) {
            throw new IllegalStateException(BOOM);
        }
    }
}
