package com.github.salilvnair.portassist.response;

import com.github.salilvnair.portassist.engine.constants.ProofKeyConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only shape the orchestrator returns: a human readable message,
 * optional structured data and the trace proofs.
 */
public record NormalizedResponse(String message, Object data, Map<String, Object> proofs) {

    public NormalizedResponse {
        proofs = proofs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(proofs));
    }

    public String status() {
        Object status = proofs.get(ProofKeyConstants.STATUS);
        return status == null ? null : String.valueOf(status);
    }

    public String traceId() {
        Object traceId = proofs.get(ProofKeyConstants.TRACE_ID);
        return traceId == null ? null : String.valueOf(traceId);
    }
}
