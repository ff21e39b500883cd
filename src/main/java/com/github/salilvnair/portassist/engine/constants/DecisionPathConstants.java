package com.github.salilvnair.portassist.engine.constants;

/**
 * Decision trail tokens. The literals are a stable contract with callers.
 */
public final class DecisionPathConstants {

    private DecisionPathConstants() {
    }

    public static final String INTENT_PREFIX = "intent:";
    public static final String ENTITIES_PREFIX = "entities:";
    public static final String FOLLOW_UP_PREFIX = "follow_up:";
    public static final String RBAC_GRANTED = "rbac_granted";
    public static final String RBAC_DENIED = "rbac_denied";
    public static final String OWNERSHIP_DEFERRED = "ownership_deferred";
    public static final String AGENT_PREFIX = "agent:";
    public static final String AGENT_NOT_IMPLEMENTED = "agent_not_implemented";
    public static final String AGENT_EXECUTED = "agent_executed";
    public static final String AGENT_FAILED_PREFIX = "agent_failed:";
    public static final String HELP_GENERATED = "help_generated";
    public static final String SMALLTALK_REPLIED = "smalltalk_replied";
    public static final String UNKNOWN_INTENT = "unknown_intent";

    public static String intent(String intentCode) {
        return INTENT_PREFIX + intentCode;
    }

    public static String entities(int count) {
        return ENTITIES_PREFIX + count;
    }

    public static String followUp(String intentCode) {
        return FOLLOW_UP_PREFIX + intentCode;
    }

    public static String agent(String handlerName) {
        return AGENT_PREFIX + handlerName;
    }

    public static String agentFailed(String kind) {
        return AGENT_FAILED_PREFIX + kind;
    }
}
