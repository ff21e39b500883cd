package com.github.salilvnair.portassist.intent;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-table classifier. Every rule of every tier is evaluated; the intent
 * whose best rule carries the highest declared confidence wins and ties go
 * to the earlier tier.
 */
@Slf4j
@Component
public class IntentClassifier implements IntentResolver {

    public static final String EMPTY_MESSAGE_RULE = "empty_message";
    public static final String NO_MATCH_RULE = "no_pattern_matched";
    public static final double NO_MATCH_CONFIDENCE = 0.5d;

    @Override
    public IntentDecision resolve(String userText, List<ConversationTurn> history) {
        return classify(userText);
    }

    public IntentDecision classify(String userText) {
        if (userText == null || userText.isBlank()) {
            return new IntentDecision(
                    Intent.UNKNOWN,
                    1.0d,
                    List.of(EMPTY_MESSAGE_RULE),
                    EntityHints.NONE,
                    IntentDecision.Source.NONE
            );
        }

        String normalized = userText.trim().toLowerCase(Locale.ROOT);
        IntentRuleTable.Tier winner = null;
        double winnerConfidence = 0.0d;
        List<String> winnerRules = List.of();

        for (IntentRuleTable.Tier tier : IntentRuleTable.tiers()) {
            List<String> fired = new ArrayList<>();
            double best = 0.0d;
            for (IntentRule rule : tier.rules()) {
                if (rule.matches(normalized)) {
                    fired.add(rule.getRuleId());
                    best = Math.max(best, rule.getConfidence());
                }
            }
            if (fired.isEmpty()) {
                continue;
            }
            log.debug("Intent tier {} fired rules {} (best={})", tier.intent(), fired, best);
            if (winner == null || best > winnerConfidence) {
                winner = tier;
                winnerConfidence = best;
                winnerRules = fired;
            }
        }

        if (winner == null) {
            return new IntentDecision(
                    Intent.UNKNOWN,
                    NO_MATCH_CONFIDENCE,
                    List.of(NO_MATCH_RULE),
                    EntityHints.NONE,
                    IntentDecision.Source.NONE
            );
        }

        return new IntentDecision(
                winner.intent(),
                winnerConfidence,
                winnerRules,
                IntentRuleTable.entityHints(winner.intent()),
                IntentDecision.Source.CLASSIFIER
        );
    }
}
