package com.github.salilvnair.portassist.intent;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Carries the last business intent of the conversation over to a short or
 * continuation-style message that matched no rule ("and yesterday?").
 */
@Slf4j
@Component
public class FollowUpResolver implements IntentResolver {

    public static final double FOLLOW_UP_CONFIDENCE = 0.70d;
    public static final String FOLLOW_UP_RULE = "follow_up";
    public static final String LAST_INTENT_RULE_PREFIX = "last_intent:";

    static final int MAX_SHORT_MESSAGE_WORDS = 4;

    private static final Pattern CONTINUATION_CUE = Pattern.compile(
            "\\b(and|what about|then|also|too|same|yesterday|tomorrow|today|next|previous"
                    + "|et|et pour|puis|aussi|même|hier|demain|aujourd['’]hui|pareil)\\b",
            IntentRule.REGEX_FLAGS
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public IntentDecision resolve(String userText, List<ConversationTurn> history) {
        if (userText == null || userText.isBlank() || history == null || history.isEmpty()) {
            return null;
        }
        if (!isFollowUp(userText)) {
            return null;
        }
        Optional<Intent> lastIntent = lastBusinessIntent(history);
        if (lastIntent.isEmpty()) {
            return null;
        }
        Intent intent = lastIntent.get();
        log.debug("Follow-up message carried over intent {}", intent);
        return new IntentDecision(
                intent,
                FOLLOW_UP_CONFIDENCE,
                List.of(FOLLOW_UP_RULE, LAST_INTENT_RULE_PREFIX + intent.code()),
                IntentRuleTable.entityHints(intent),
                IntentDecision.Source.FOLLOW_UP
        );
    }

    public boolean isFollowUp(String userText) {
        String trimmed = userText.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        int words = WHITESPACE.split(trimmed).length;
        return words <= MAX_SHORT_MESSAGE_WORDS || CONTINUATION_CUE.matcher(trimmed).find();
    }

    /**
     * Newest first. Outcome tags (denied, forbidden, not_implemented) and meta
     * intents are stepped over.
     */
    public Optional<Intent> lastBusinessIntent(List<ConversationTurn> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationTurn turn = history.get(i);
            if (turn == null) {
                continue;
            }
            Optional<Intent> parsed = Intent.fromCode(turn.intent());
            if (parsed.isPresent() && !parsed.get().isMeta()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
