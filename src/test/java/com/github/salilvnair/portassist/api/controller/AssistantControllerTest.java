package com.github.salilvnair.portassist.api.controller;

import com.github.salilvnair.portassist.config.PortAssistConfig;
import com.github.salilvnair.portassist.dispatch.ExecutionContext;
import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.core.OrchestrationEngine;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import com.github.salilvnair.portassist.response.ResponseNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static com.github.salilvnair.portassist.support.TestConstants.AUTH_HEADER;
import static com.github.salilvnair.portassist.support.TestConstants.CARRIER_ID;
import static com.github.salilvnair.portassist.support.TestConstants.FIXED_INSTANT;
import static com.github.salilvnair.portassist.support.TestConstants.TRACE_ID;
import static com.github.salilvnair.portassist.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AssistantControllerTest {

    private static final String REQUEST_BODY = """
            {
              "message": "What's the score for carrier 123?",
              "history": [{"role": "user", "content": "hello", "intent": "help"}],
              "user_role": "carrier",
              "userId": "user-42",
              "traceId": "trace-0001-abcdef",
              "context": {"carrier_id": "123"}
            }
            """;

    @Mock
    private OrchestrationEngine engine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ResponseNormalizer normalizer = new ResponseNormalizer(
                new PortAssistConfig(),
                Clock.fixed(Instant.parse(FIXED_INSTANT), ZoneOffset.UTC)
        );
        mockMvc = MockMvcBuilders.standaloneSetup(new AssistantController(engine, normalizer)).build();
    }

    @Test
    void requestIsMappedOntoTheEngineContext() throws Exception {
        when(engine.process(any())).thenReturn(
                new NormalizedResponse("Score: 87.0/100 (Tier A)", Map.of("score", 87.0), Map.of("status", "ok")));

        mockMvc.perform(post("/api/v1/assistant/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", AUTH_HEADER)
                        .content(REQUEST_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Score: 87.0/100 (Tier A)"))
                .andExpect(jsonPath("$.proofs.status").value("ok"));

        ArgumentCaptor<EngineContext> captor = ArgumentCaptor.forClass(EngineContext.class);
        verify(engine).process(captor.capture());
        EngineContext ctx = captor.getValue();
        assertEquals("What's the score for carrier 123?", ctx.getUserText());
        assertEquals("carrier", ctx.getUserRole());
        assertEquals(USER_ID, ctx.getUserId());
        assertEquals(TRACE_ID, ctx.getTraceId());
        assertTrue(ctx.isAuthPresent());
        assertEquals(1, ctx.getHistory().size());
        assertEquals("help", ctx.getHistory().get(0).intent());
        assertEquals(CARRIER_ID, ctx.getExtraContext().get("carrier_id"));
        assertEquals(AUTH_HEADER, ctx.getExtraContext().get(ExecutionContext.AUTH_HEADER_KEY));
    }

    @Test
    void missingAuthorizationHeaderMeansUnauthenticated() throws Exception {
        when(engine.process(any())).thenReturn(new NormalizedResponse("ok", null, Map.of()));

        mockMvc.perform(post("/api/v1/assistant/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"help\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<EngineContext> captor = ArgumentCaptor.forClass(EngineContext.class);
        verify(engine).process(captor.capture());
        assertFalse(captor.getValue().isAuthPresent());
        assertFalse(captor.getValue().getExtraContext().containsKey(ExecutionContext.AUTH_HEADER_KEY));
        assertEquals(36, captor.getValue().getTraceId().length());
    }

    @Test
    void engineFailureIsAFailedResponse() throws Exception {
        when(engine.process(any())).thenThrow(new PortAssistException(PortAssistErrorCode.PIPELINE_NO_FINAL_RESULT));

        mockMvc.perform(post("/api/v1/assistant/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(ResponseNormalizer.UNEXPECTED_FAILURE_MESSAGE))
                .andExpect(jsonPath("$.data.error_type").value("PIPELINE_NO_FINAL_RESULT"))
                .andExpect(jsonPath("$.proofs.status").value("failed"))
                .andExpect(jsonPath("$.proofs.trace_id").value(TRACE_ID));
    }

    @Test
    void unexpectedExceptionIsAnInternalError() throws Exception {
        when(engine.process(any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/assistant/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.error_type").value(PortAssistErrorCode.INTERNAL_ERROR.name()));
    }
}
