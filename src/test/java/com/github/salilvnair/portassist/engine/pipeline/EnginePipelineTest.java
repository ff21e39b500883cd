package com.github.salilvnair.portassist.engine.pipeline;

import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_HELP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnginePipelineTest {

    @Test
    void stopsAtTheFirstStopResult() {
        List<String> calls = new ArrayList<>();
        NormalizedResponse response = new NormalizedResponse("done", null, Map.of());
        EnginePipeline pipeline = new EnginePipeline(List.of(
                session -> {
                    calls.add("first");
                    return new StepResult.Continue();
                },
                session -> {
                    calls.add("second");
                    return new StepResult.Stop(response);
                },
                session -> {
                    calls.add("third");
                    return new StepResult.Continue();
                }
        ));

        assertSame(response, pipeline.execute(newSession()));
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void finalResultIsReturnedWhenNoStepStops() {
        NormalizedResponse response = new NormalizedResponse("done", null, Map.of());
        EnginePipeline pipeline = new EnginePipeline(List.of(session -> {
            session.setFinalResult(response);
            return new StepResult.Continue();
        }));

        assertSame(response, pipeline.execute(newSession()));
    }

    @Test
    void missingFinalResultFails() {
        EnginePipeline pipeline = new EnginePipeline(List.of(session -> new StepResult.Continue()));

        PortAssistException ex = assertThrows(PortAssistException.class, () -> pipeline.execute(newSession()));
        assertEquals(PortAssistErrorCode.PIPELINE_NO_FINAL_RESULT.name(), ex.getErrorCode());
    }

    private EngineSession newSession() {
        return new EngineSession(EngineContext.builder()
                .userText(USER_TEXT_HELP)
                .build(), LocalDate.of(2026, 3, 10));
    }
}
