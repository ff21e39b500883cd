package com.github.salilvnair.portassist.intent;

import com.github.salilvnair.portassist.engine.history.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@RequiredArgsConstructor
@Component
public class CompositeIntentResolver implements IntentResolver {

    private final IntentClassifier classifier;
    private final FollowUpResolver followUpResolver;

    @Override
    public IntentDecision resolve(String userText, List<ConversationTurn> history) {

        IntentDecision classified = classifier.classify(userText);

        if (!classified.isUnknown() || userText == null || userText.isBlank()) {
            return classified;
        }

        IntentDecision followUp = followUpResolver.resolve(userText, history);

        return followUp != null ? followUp : classified;
    }
}
