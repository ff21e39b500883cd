package com.github.salilvnair.portassist.intent;

import java.util.List;

public record IntentDecision(
        Intent intent,
        double confidence,
        List<String> matchedRules,
        EntityHints entityHints,
        Source source
) {

    public IntentDecision {
        if (intent == null) {
            throw new IllegalArgumentException("intent cannot be null");
        }
        if (confidence < 0.0d || confidence > 1.0d) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
        entityHints = entityHints == null ? EntityHints.NONE : entityHints;
    }

    public boolean isUnknown() {
        return intent == Intent.UNKNOWN;
    }

    public enum Source {
        CLASSIFIER,
        FOLLOW_UP,
        NONE
    }
}
