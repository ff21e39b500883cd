package com.github.salilvnair.portassist.api.controller;

import com.github.salilvnair.portassist.api.dto.AssistantRequest;
import com.github.salilvnair.portassist.dispatch.ExecutionContext;
import com.github.salilvnair.portassist.engine.context.EngineContext;
import com.github.salilvnair.portassist.engine.core.OrchestrationEngine;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.response.NormalizedResponse;
import com.github.salilvnair.portassist.response.ResponseNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private final OrchestrationEngine engine;
    private final ResponseNormalizer normalizer;

    @PostMapping("/message")
    public NormalizedResponse message(@RequestBody AssistantRequest request,
                                      @RequestHeader(value = "Authorization", required = false) String authorization) {

        String traceId = request.getTraceId() == null || request.getTraceId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getTraceId().trim();
        boolean authPresent = authorization != null && !authorization.isBlank();

        Map<String, Object> extraContext = new LinkedHashMap<>();
        if (request.getContext() != null) {
            extraContext.putAll(request.getContext());
        }
        if (authPresent) {
            extraContext.put(ExecutionContext.AUTH_HEADER_KEY, authorization);
        }

        EngineContext engineContext =
                EngineContext.builder()
                        .userText(request.getMessage())
                        .history(request.getHistory() == null
                                ? List.of()
                                : request.getHistory().stream().filter(Objects::nonNull).toList())
                        .userRole(request.getUserRole())
                        .userId(request.getUserId())
                        .traceId(traceId)
                        .authPresent(authPresent)
                        .extraContext(extraContext)
                        .build();

        try {
            return engine.process(engineContext);
        }
        catch (PortAssistException ex) {
            log.error("[{}] Engine failure {} (recoverable={})", traceId, ex.getErrorCode(), ex.isRecoverable(), ex);
            return normalizer.failure(ResponseNormalizer.UNEXPECTED_FAILURE_MESSAGE, ex.getErrorCode(), traceId, List.of());
        }
        catch (Exception ex) {
            log.error("[{}] Unexpected engine failure", traceId, ex);
            return normalizer.failure(ResponseNormalizer.UNEXPECTED_FAILURE_MESSAGE, PortAssistErrorCode.INTERNAL_ERROR.name(), traceId, List.of());
        }
    }
}
