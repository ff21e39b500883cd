package com.github.salilvnair.portassist.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.portassist.intent.IntentRule.contains;
import static com.github.salilvnair.portassist.intent.IntentRule.regex;
import static com.github.salilvnair.portassist.intent.IntentRule.startsWith;

/**
 * Priority-ordered classification table. Tiers are listed highest priority
 * first: meta intents, then intents whose wording is a superset signal of a
 * more generic one (an audit request may also carry a booking reference), and
 * the generic booking lookup and smalltalk last.
 * <p>
 * French and English variants of the same intent live in the same tier.
 */
public final class IntentRuleTable {

    private static final List<Tier> TIERS;
    private static final Map<Intent, EntityHints> ENTITY_HINTS;

    static {
        List<Tier> tiers = new ArrayList<>();

        tiers.add(new Tier(Intent.HELP, List.of(
                regex("help_keyword", Intent.HELP,
                        "\\b(help|assist|what can|how to|guide|aide|comment)\\b", 0.95),
                regex("greeting", Intent.HELP,
                        "^(hi|hello|hey|bonjour|salam|salut)([\\s!,.]|$)", 0.95),
                regex("capability_query", Intent.HELP,
                        "\\b(what (can|do) you|qu['’]est-ce que tu|que peux-tu)\\b", 0.90),
                startsWith("help_command", Intent.HELP, List.of("/help", "/aide"), 0.95)
        )));

        tiers.add(new Tier(Intent.BLOCKCHAIN_AUDIT, List.of(
                regex("blockchain_booking", Intent.BLOCKCHAIN_AUDIT,
                        "\\b(blockchain|proof|verify|audit|trace|prouv|vérif)\\b.*\\b(booking|reservation|ref|transaction)\\b", 0.90),
                contains("blockchain_keyword", Intent.BLOCKCHAIN_AUDIT, List.of("blockchain", "on-chain"), 0.86),
                regex("audit_keyword", Intent.BLOCKCHAIN_AUDIT,
                        "\\b(prove|verify|audit|trace|prouv|vérif)\\b", 0.85)
        )));

        tiers.add(new Tier(Intent.ANOMALY_DETECTION, List.of(
                regex("anomaly_keyword", Intent.ANOMALY_DETECTION,
                        "\\b(anomaly|anomalies|anomalie|anomalies|unusual|suspicious|suspect|anormal|inhabituel)\\b", 0.92),
                regex("recurrent_issue", Intent.ANOMALY_DETECTION,
                        "\\b(no-show|delay|retard|absence).*\\b(recurrent|frequent|récurrent|fréquent)", 0.90),
                regex("detect_anomaly", Intent.ANOMALY_DETECTION,
                        "\\b(detect|find|show|détecter|trouver|afficher).*\\b(anomaly|anomalies|issues?|problèmes?)\\b", 0.88)
        )));

        tiers.add(new Tier(Intent.CARRIER_SCORE, List.of(
                regex("carrier_score_explicit", Intent.CARRIER_SCORE,
                        "\\b(carrier|driver|company|transporteur|chauffeur|société).*\\b(score|rating|reliability|note|fiabilité|performance)\\b", 0.95),
                regex("score_carrier_reversed", Intent.CARRIER_SCORE,
                        "\\b(score|rating|note|fiabilité).*\\b(carrier|driver|transporteur|chauffeur)\\b", 0.95),
                regex("reliability_query", Intent.CARRIER_SCORE,
                        "\\b(how reliable|quelle fiabilité|performance of|performance de)\\b", 0.88),
                regex("rate_carrier", Intent.CARRIER_SCORE,
                        "\\b(rate|noter|évaluer).*\\b(carrier|transporteur)\\b", 0.85)
        )));

        tiers.add(new Tier(Intent.DRIVER_NOSHOW_RISK, List.of(
                regex("noshow_risk_explicit", Intent.DRIVER_NOSHOW_RISK,
                        "\\b(no-show|noshow).*\\b(risk|prediction|probabilité|risque)\\b", 0.92),
                regex("risk_noshow_reversed", Intent.DRIVER_NOSHOW_RISK,
                        "\\b(risk|risque).*\\b(no-show|noshow|absence)\\b", 0.92),
                regex("predict_noshow", Intent.DRIVER_NOSHOW_RISK,
                        "\\b(predict|prédire|prévoir).*\\b(no-show|noshow|absence)\\b", 0.90)
        )));

        tiers.add(new Tier(Intent.ANALYTICS_STRESS_INDEX, List.of(
                regex("stress_index_keyword", Intent.ANALYTICS_STRESS_INDEX,
                        "\\b(stress index|stress level|indice de stress|niveau de stress)\\b", 0.92),
                regex("terminal_stress", Intent.ANALYTICS_STRESS_INDEX,
                        "\\b(stress|saturation)\\b.*\\b(terminal|port|gate|porte)\\b", 0.86)
        )));

        tiers.add(new Tier(Intent.ANALYTICS_ALERTS, List.of(
                regex("proactive_alerts", Intent.ANALYTICS_ALERTS,
                        "\\b(proactive alerts?|alertes? proactives?)\\b", 0.92),
                regex("list_alerts", Intent.ANALYTICS_ALERTS,
                        "\\b(show|list|any|afficher|lister|quelles?)\\b.*\\b(alerts?|alertes?)\\b", 0.86)
        )));

        tiers.add(new Tier(Intent.ANALYTICS_WHAT_IF, List.of(
                regex("what_if_keyword", Intent.ANALYTICS_WHAT_IF,
                        "\\b(what if|what-if|et si|que se passe-t-il si)\\b", 0.92),
                regex("simulate_keyword", Intent.ANALYTICS_WHAT_IF,
                        "\\b(simulate|simulation|simuler)\\b", 0.88)
        )));

        tiers.add(new Tier(Intent.TRAFFIC_FORECAST, List.of(
                regex("traffic_forecast_explicit", Intent.TRAFFIC_FORECAST,
                        "\\b(traffic|congestion|trafic).*\\b(forecast|predict|tomorrow|future|prévision|demain|futur)\\b", 0.90),
                regex("future_traffic", Intent.TRAFFIC_FORECAST,
                        "\\b(tomorrow|next|demain|prochain).*\\b(traffic|congestion|busy|trafic|affluence)\\b", 0.88),
                regex("predict_traffic", Intent.TRAFFIC_FORECAST,
                        "\\b(predict|forecast|prévoir|prédire).*\\b(traffic|load|trafic|charge)\\b", 0.85)
        )));

        tiers.add(new Tier(Intent.PASSAGE_HISTORY, List.of(
                regex("passage_history_explicit", Intent.PASSAGE_HISTORY,
                        "\\b(passage|entry|entries|truck|vehicle|camion|véhicule).*\\b(history|yesterday|past|previous|historique|hier|passé|précédent)\\b", 0.90),
                regex("show_passage", Intent.PASSAGE_HISTORY,
                        "\\b(show|list|get|afficher|lister).*\\b(passage|entry|entries|truck|camion)", 0.85),
                regex("yesterday_passage", Intent.PASSAGE_HISTORY,
                        "\\byesterday.*\\b(passage|truck|entry|entries|camion)", 0.88),
                regex("french_yesterday_passage", Intent.PASSAGE_HISTORY,
                        "\\b(hier|yesterday).*\\b(passage|entrée|camion)", 0.88)
        )));

        tiers.add(new Tier(Intent.SLOT_RECOMMENDATION, List.of(
                regex("recommend_slot_explicit", Intent.SLOT_RECOMMENDATION,
                        "\\b(recommend|recommande|recommander|suggest|suggère|suggérer|best|optimal|conseille|conseiller|meilleur)\\b.*\\b(slots?|times?|créneaux|créneau|heures?)\\b", 0.92),
                regex("which_best_slot", Intent.SLOT_RECOMMENDATION,
                        "\\b(which|what|quel).*\\b(slots?|times?|créneaux|créneau).*\\b(best|better|recommend|meilleur|conseillé)\\b", 0.90),
                regex("alternative_slot", Intent.SLOT_RECOMMENDATION,
                        "\\b(alternative|other|autre).*\\b(slots?|times?|créneaux|créneau)\\b", 0.85)
        )));

        tiers.add(new Tier(Intent.SLOT_AVAILABILITY, List.of(
                regex("slot_availability_explicit", Intent.SLOT_AVAILABILITY,
                        "\\b(available|availability|free|open|disponible|disponibles|disponibilité|libre|libres|ouvert)\\b.*\\b(slots?|times?|appointments?|créneaux|créneau|heures?|rendez-vous)\\b", 0.90),
                regex("slot_available_reversed", Intent.SLOT_AVAILABILITY,
                        "\\b(slots?|times?|appointments?|créneaux|créneau|heures?)\\b.*\\b(available|free|open|disponible|disponibles|libre|libres)\\b", 0.90),
                regex("book_slot", Intent.SLOT_AVAILABILITY,
                        "\\b(book|reserve|schedule|réserver|planifier)\\b.*\\b(slots?|times?|créneaux|créneau|heures?)\\b", 0.85),
                regex("check_availability", Intent.SLOT_AVAILABILITY,
                        "\\b(check|voir|vérifier)\\b.*\\b(availability|disponibilité|disponibilités)\\b", 0.82),
                regex("availability_keyword", Intent.SLOT_AVAILABILITY,
                        "\\b(availability|disponibilité|disponibilités)\\b", 0.80)
        )));

        tiers.add(new Tier(Intent.BOOKING_STATUS, List.of(
                regex("status_booking_explicit", Intent.BOOKING_STATUS,
                        "\\b(status|track|where|check|find|locate|statut|suivre|où|vérifier|trouver|localiser)\\b.*\\b(booking|reservation|ref|reference|réservation|référence)\\b", 0.90),
                regex("booking_status_reversed", Intent.BOOKING_STATUS,
                        "\\b(booking|reservation|ref|reference|réservation)\\b.*\\b(status|track|where|check|statut|suivre|où)\\b", 0.90),
                regex("booking_ref_pattern", Intent.BOOKING_STATUS,
                        "\\bref[-\\s]?\\d{3,}\\b", 0.85),
                regex("where_booking", Intent.BOOKING_STATUS,
                        "\\b(where is|où est|quand|when)\\b.*\\b(booking|reservation|my|ma|mon)\\b", 0.82)
        )));

        tiers.add(new Tier(Intent.SMALLTALK, List.of(
                regex("acknowledgment", Intent.SMALLTALK,
                        "^(ok|okay|d['’]accord|merci|thanks|thank you|oui|yes|non|no)([\\s!.,]|$)", 0.70),
                regex("positive_short", Intent.SMALLTALK,
                        "^(good|bien|bon)([\\s!.,]|$)", 0.65),
                regex("how_are_you", Intent.SMALLTALK,
                        "\\b(how are you|comment ça va|ça va)\\b", 0.75)
        )));

        TIERS = Collections.unmodifiableList(tiers);

        Map<Intent, EntityHints> hints = new EnumMap<>(Intent.class);
        hints.put(Intent.BOOKING_STATUS, new EntityHints(List.of("booking_ref"), List.of("date")));
        hints.put(Intent.CARRIER_SCORE, new EntityHints(List.of("carrier_id"), List.of()));
        hints.put(Intent.SLOT_AVAILABILITY, new EntityHints(List.of("terminal", "date"), List.of("gate")));
        hints.put(Intent.SLOT_RECOMMENDATION, new EntityHints(List.of("terminal", "date"), List.of("gate", "carrier_id", "requested_time")));
        hints.put(Intent.DRIVER_NOSHOW_RISK, new EntityHints(List.of(), List.of("carrier_id", "booking_ref", "booking_status")));
        hints.put(Intent.PASSAGE_HISTORY, new EntityHints(List.of("date"), List.of("terminal", "gate")));
        hints.put(Intent.TRAFFIC_FORECAST, new EntityHints(List.of("date"), List.of("terminal")));
        hints.put(Intent.ANOMALY_DETECTION, new EntityHints(List.of(), List.of("date", "terminal", "carrier_id")));
        hints.put(Intent.BLOCKCHAIN_AUDIT, new EntityHints(List.of("booking_ref"), List.of()));
        hints.put(Intent.ANALYTICS_STRESS_INDEX, new EntityHints(List.of(), List.of("date", "terminal")));
        hints.put(Intent.ANALYTICS_ALERTS, new EntityHints(List.of(), List.of("date", "terminal")));
        hints.put(Intent.ANALYTICS_WHAT_IF, new EntityHints(List.of(), List.of("date", "terminal")));
        ENTITY_HINTS = Collections.unmodifiableMap(hints);
    }

    private IntentRuleTable() {
    }

    public static List<Tier> tiers() {
        return TIERS;
    }

    public static EntityHints entityHints(Intent intent) {
        return ENTITY_HINTS.getOrDefault(intent, EntityHints.NONE);
    }

    /**
     * Lowest declared confidence among the rules of the intent's tier, 0 when
     * the intent has no rule.
     */
    public static double minimumConfidence(Intent intent) {
        return TIERS.stream()
                .filter(t -> t.intent() == intent)
                .flatMap(t -> t.rules().stream())
                .mapToDouble(IntentRule::getConfidence)
                .min()
                .orElse(0.0d);
    }

    public record Tier(Intent intent, List<IntentRule> rules) {
        public Tier {
            rules = List.copyOf(rules);
        }
    }
}
