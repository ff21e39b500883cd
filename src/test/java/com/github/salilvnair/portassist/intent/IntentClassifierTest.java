package com.github.salilvnair.portassist.intent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_AVAILABILITY;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_BOOKING_STATUS;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_CARRIER_SCORE;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_GIBBERISH;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_PASSAGES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    void bookingReferenceAloneResolvesToBookingStatus() {
        IntentDecision decision = classifier.classify(USER_TEXT_BOOKING_STATUS);

        assertEquals(Intent.BOOKING_STATUS, decision.intent());
        assertEquals(0.85d, decision.confidence());
        assertEquals(List.of("booking_ref_pattern"), decision.matchedRules());
        assertEquals(List.of("booking_ref"), decision.entityHints().expected());
        assertEquals(IntentDecision.Source.CLASSIFIER, decision.source());
    }

    @Test
    void englishAndFrenchPhrasesResolveToTheirIntent() {
        assertClassified(USER_TEXT_AVAILABILITY, Intent.SLOT_AVAILABILITY, 0.80d);
        assertClassified("Quels sont les créneaux disponibles demain ?", Intent.SLOT_AVAILABILITY, 0.90d);
        assertClassified(USER_TEXT_CARRIER_SCORE, Intent.CARRIER_SCORE, 0.95d);
        assertClassified("Quelle est la fiabilité du transporteur 45 ?", Intent.CARRIER_SCORE, 0.95d);
        assertClassified("Où est ma réservation ?", Intent.BOOKING_STATUS, 0.90d);
        assertClassified(USER_TEXT_PASSAGES, Intent.PASSAGE_HISTORY, 0.88d);
        assertClassified("What's tomorrow's traffic forecast?", Intent.TRAFFIC_FORECAST, 0.90d);
        assertClassified("Detect anomalies at terminal A", Intent.ANOMALY_DETECTION, 0.92d);
        assertClassified("Predict no-show risk for carrier 123", Intent.DRIVER_NOSHOW_RISK, 0.92d);
        assertClassified("Recommend a slot tomorrow at terminal B", Intent.SLOT_RECOMMENDATION, 0.92d);
        assertClassified("What is the stress index at terminal A?", Intent.ANALYTICS_STRESS_INDEX, 0.92d);
        assertClassified("Show proactive alerts", Intent.ANALYTICS_ALERTS, 0.92d);
        assertClassified("What if gate 3 closes tomorrow?", Intent.ANALYTICS_WHAT_IF, 0.92d);
    }

    @Test
    void confidenceIsAtLeastTheDeclaredMinimumOfTheIntent() {
        IntentDecision decision = classifier.classify(USER_TEXT_AVAILABILITY);

        assertTrue(decision.confidence() >= IntentRuleTable.minimumConfidence(decision.intent()));
    }

    @Test
    void allFiredRulesOfTheWinningTierAreReportedInTableOrder() {
        IntentDecision decision = classifier.classify(USER_TEXT_PASSAGES);

        assertEquals(
                List.of("show_passage", "yesterday_passage", "french_yesterday_passage"),
                decision.matchedRules()
        );
    }

    @Test
    void tiedConfidenceGoesToTheEarlierTier() {
        // audit_keyword and booking_ref_pattern both declare 0.85
        IntentDecision decision = classifier.classify("Prove booking REF123");

        assertEquals(Intent.BLOCKCHAIN_AUDIT, decision.intent());
        assertEquals(List.of("audit_keyword"), decision.matchedRules());
    }

    @Test
    void higherConfidenceBeatsEarlierTier() {
        IntentDecision decision = classifier.classify("Verify the blockchain proof for booking REF123");

        assertEquals(Intent.BLOCKCHAIN_AUDIT, decision.intent());
        assertEquals(0.90d, decision.confidence());
        assertEquals(List.of("blockchain_booking", "blockchain_keyword", "audit_keyword"), decision.matchedRules());
    }

    @Test
    void greetingsAndHelpCommandsResolveToHelp() {
        assertClassified("Bonjour", Intent.HELP, 0.95d);
        assertClassified("Hello there", Intent.HELP, 0.95d);

        IntentDecision command = classifier.classify("/help");
        assertEquals(Intent.HELP, command.intent());
        assertEquals(List.of("help_keyword", "help_command"), command.matchedRules());
    }

    @Test
    void acknowledgementsResolveToSmalltalk() {
        assertClassified("thanks!", Intent.SMALLTALK, 0.70d);
        assertClassified("ok", Intent.SMALLTALK, 0.70d);
    }

    @Test
    void unmatchedTextIsUnknownAtHalfConfidence() {
        IntentDecision decision = classifier.classify(USER_TEXT_GIBBERISH);

        assertEquals(Intent.UNKNOWN, decision.intent());
        assertEquals(IntentClassifier.NO_MATCH_CONFIDENCE, decision.confidence());
        assertEquals(List.of(IntentClassifier.NO_MATCH_RULE), decision.matchedRules());
        assertEquals(IntentDecision.Source.NONE, decision.source());
    }

    @Test
    void blankTextIsUnknownWithFullConfidence() {
        IntentDecision decision = classifier.classify("   ");

        assertEquals(Intent.UNKNOWN, decision.intent());
        assertEquals(1.0d, decision.confidence());
        assertEquals(List.of(IntentClassifier.EMPTY_MESSAGE_RULE), decision.matchedRules());
    }

    @Test
    void classificationIgnoresCase() {
        assertEquals(
                classifier.classify(USER_TEXT_CARRIER_SCORE),
                classifier.classify(USER_TEXT_CARRIER_SCORE.toUpperCase())
        );
    }

    private void assertClassified(String text, Intent expected, double confidence) {
        IntentDecision decision = classifier.classify(text);
        assertEquals(expected, decision.intent(), text);
        assertEquals(confidence, decision.confidence(), text);
    }
}
