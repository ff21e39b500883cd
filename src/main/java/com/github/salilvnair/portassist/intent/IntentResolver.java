package com.github.salilvnair.portassist.intent;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;

import java.util.List;

public interface IntentResolver {
    /**
     * Return resolved intent decision or null if not resolved.
     */
    IntentDecision resolve(String userText, List<ConversationTurn> history);
}
