package com.github.salilvnair.portassist.engine.constants;

public final class ProofKeyConstants {

    private ProofKeyConstants() {
    }

    public static final String TRACE_ID = "trace_id";
    public static final String STATUS = "status";
    public static final String COMPONENT = "component";
    public static final String TIMESTAMP = "timestamp";
    public static final String DECISION_PATH = "decision_path";
    public static final String INTENT = "intent";
}
