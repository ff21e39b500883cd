package com.github.salilvnair.portassist.engine.exception;

public enum PortAssistErrorCode {

    // =========================
    // Engine / pipeline errors
    // =========================
    PIPELINE_NO_FINAL_RESULT(
            "Pipeline completed without producing final result",
            false
    ),

    DUPLICATE_ENGINE_STEP(
            "Duplicate EngineStep bean detected",
            false
    ),

    MISSING_TERMINAL_STEP(
            "Missing required TerminalStep",
            false
    ),

    MISSING_DEPENDENT_STEP(
            "EngineStep dependency is missing",
            false
    ),

    STEP_DAG_CYCLE(
            "EngineStep DAG cycle or unsatisfied constraints",
            false
    ),

    // =========================
    // Capability registry errors
    // =========================
    DUPLICATE_CAPABILITY_HANDLER(
            "Duplicate capability handler name detected",
            false
    ),

    INVALID_CAPABILITY_HANDLER(
            "Capability handler has no usable name",
            false
    ),

    INVALID_ROUTE(
            "Dispatch route references an unknown or meta intent",
            false
    ),

    // =========================
    // Remote handler errors
    // =========================
    REMOTE_HANDLER_MISCONFIGURED(
            "Remote capability handler has no URL configured",
            false
    ),

    HANDLER_UPSTREAM_STATUS(
            "Remote capability handler returned a non-success status",
            true
    ),

    HANDLER_IO_FAILURE(
            "Remote capability handler could not be reached",
            true
    ),

    HANDLER_INTERRUPTED(
            "Remote capability handler call was interrupted",
            true
    ),

    HANDLER_INVALID_RESPONSE(
            "Remote capability handler returned an unreadable body",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal orchestration error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    PortAssistErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
