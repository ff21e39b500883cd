package com.github.salilvnair.portassist.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed intent vocabulary. Codes are stable identifiers shared with the
 * conversation store and the capability handlers.
 */
public enum Intent {

    BOOKING_STATUS("booking_status", false),
    CARRIER_SCORE("carrier_score", false),
    SLOT_AVAILABILITY("slot_availability", false),
    SLOT_RECOMMENDATION("slot_recommendation", false),
    DRIVER_NOSHOW_RISK("driver_noshow_risk", false),
    PASSAGE_HISTORY("passage_history", false),
    TRAFFIC_FORECAST("traffic_forecast", false),
    ANOMALY_DETECTION("anomaly_detection", false),
    BLOCKCHAIN_AUDIT("blockchain_audit", false),
    ANALYTICS_STRESS_INDEX("analytics_stress_index", false),
    ANALYTICS_ALERTS("analytics_alerts", false),
    ANALYTICS_WHAT_IF("analytics_what_if", false),

    HELP("help", true),
    SMALLTALK("smalltalk", true),
    UNKNOWN("unknown", true);

    public static final String VOCABULARY_VERSION = "2";

    private final String code;
    private final boolean meta;

    Intent(String code, boolean meta) {
        this.code = code;
        this.meta = meta;
    }

    public String code() {
        return code;
    }

    public boolean isMeta() {
        return meta;
    }

    public static Optional<Intent> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.code.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
