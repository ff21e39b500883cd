package com.github.salilvnair.portassist.response;

import com.github.salilvnair.portassist.dispatch.DispatchOutcome;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.Role;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Canned replies for help, smalltalk and unrecognized messages. These never
 * reach a capability handler.
 */
@Component
public class MetaResponseBuilder {

    private static final Map<Intent, String> FEATURE_EXAMPLES;

    static final List<String> UNKNOWN_SUGGESTIONS = List.of(
            "Check booking status: 'What's the status of REF123?'",
            "Find available slots: 'Is there availability tomorrow?'",
            "View passage history: 'Show yesterday's truck entries'"
    );

    static {
        Map<Intent, String> examples = new EnumMap<>(Intent.class);
        examples.put(Intent.BOOKING_STATUS, "Check the status of your bookings (e.g., 'What's the status of REF123?')");
        examples.put(Intent.SLOT_AVAILABILITY, "Find available time slots (e.g., 'Is there availability tomorrow at Terminal A?')");
        examples.put(Intent.SLOT_RECOMMENDATION, "Get the best slot for your truck (e.g., 'Recommend a slot tomorrow at terminal B')");
        examples.put(Intent.PASSAGE_HISTORY, "View past truck passages (e.g., 'Show me yesterday's truck entries')");
        examples.put(Intent.TRAFFIC_FORECAST, "Get traffic predictions (e.g., 'What's tomorrow's traffic forecast?')");
        examples.put(Intent.ANOMALY_DETECTION, "Detect unusual patterns (e.g., 'Are there any unusual delays at terminal A?')");
        examples.put(Intent.CARRIER_SCORE, "Check carrier reliability (e.g., 'What's the score for carrier 123?')");
        examples.put(Intent.DRIVER_NOSHOW_RISK, "Estimate no-show risk (e.g., 'Predict no-show risk for carrier 123')");
        examples.put(Intent.BLOCKCHAIN_AUDIT, "Verify blockchain proofs (e.g., 'Prove booking REF123')");
        examples.put(Intent.ANALYTICS_STRESS_INDEX, "Follow terminal saturation (e.g., 'What is the stress index at terminal A?')");
        examples.put(Intent.ANALYTICS_ALERTS, "Review proactive alerts (e.g., 'Show proactive alerts')");
        examples.put(Intent.ANALYTICS_WHAT_IF, "Simulate scenarios (e.g., 'What if gate 3 closes tomorrow?')");
        FEATURE_EXAMPLES = Collections.unmodifiableMap(examples);
    }

    /**
     * @param allowedIntents intent codes the caller's role may use
     */
    public DispatchOutcome.MetaHandled help(Role role, List<String> allowedIntents) {
        List<String> features = allowedIntents.stream()
                .filter(code -> !Intent.HELP.code().equals(code))
                .sorted()
                .toList();

        String bullets = features.stream()
                .map(Intent::fromCode)
                .flatMap(Optional::stream)
                .map(FEATURE_EXAMPLES::get)
                .filter(Objects::nonNull)
                .map(example -> "• " + example)
                .collect(Collectors.joining("\n"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_role", role.name());
        data.put("available_features", features);
        return new DispatchOutcome.MetaHandled(
                Intent.HELP,
                "Hello! I'm your Smart Port assistant. Here's what I can help you with:\n\n"
                        + bullets
                        + "\n\nJust ask me in natural language!",
                data
        );
    }

    public DispatchOutcome.MetaHandled smalltalk(Role role) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_role", role.name());
        return new DispatchOutcome.MetaHandled(
                Intent.SMALLTALK,
                "You're welcome! Let me know if you need anything else.",
                data
        );
    }

    public DispatchOutcome.MetaHandled unknown() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("suggestions", UNKNOWN_SUGGESTIONS);
        return new DispatchOutcome.MetaHandled(
                Intent.UNKNOWN,
                "I'm not sure I understood your request. Here are some things you can ask me:\n\n"
                        + UNKNOWN_SUGGESTIONS.stream().map(s -> "• " + s).collect(Collectors.joining("\n")),
                data
        );
    }
}
