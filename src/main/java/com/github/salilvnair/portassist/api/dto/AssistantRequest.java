package com.github.salilvnair.portassist.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class AssistantRequest {

    private String message;
    private List<ConversationTurn> history;
    @JsonAlias("user_role")
    private String userRole;
    @JsonAlias("user_id")
    private String userId;
    @JsonAlias("trace_id")
    private String traceId;
    private Map<String, Object> context;
}
