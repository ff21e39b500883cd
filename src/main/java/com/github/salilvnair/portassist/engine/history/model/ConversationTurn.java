package com.github.salilvnair.portassist.engine.history.model;

/**
 * One prior exchange of the conversation. {@code intent} is the intent the
 * turn was resolved to, or an outcome tag such as {@code denied}, or null.
 */
public record ConversationTurn(String role, String content, String intent) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ConversationTurn user(String content, String intent) {
        return new ConversationTurn(ROLE_USER, content, intent);
    }

    public static ConversationTurn assistant(String content, String intent) {
        return new ConversationTurn(ROLE_ASSISTANT, content, intent);
    }
}
