package com.github.salilvnair.portassist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "portassist")
@Getter
@Setter
public class PortAssistConfig {

    /**
     * Zone of the reference date handed to the entity extractor.
     */
    private String zoneId = "UTC";

    private Dispatch dispatch = new Dispatch();
    private Remote remote = new Remote();
    private Response response = new Response();

    @Getter
    @Setter
    public static class Dispatch {
        /**
         * Intent code to capability handler name. Intents without an entry
         * are answered as planned features.
         */
        private Map<String, String> routes = defaultRoutes();

        private static Map<String, String> defaultRoutes() {
            Map<String, String> defaults = new LinkedHashMap<>();
            defaults.put("booking_status", "booking");
            defaults.put("carrier_score", "carrier-score");
            defaults.put("slot_availability", "slot");
            defaults.put("slot_recommendation", "slot");
            defaults.put("traffic_forecast", "traffic");
            defaults.put("anomaly_detection", "anomaly");
            defaults.put("blockchain_audit", "blockchain-audit");
            defaults.put("analytics_stress_index", "analytics");
            defaults.put("analytics_alerts", "analytics");
            defaults.put("analytics_what_if", "analytics");
            return defaults;
        }
    }

    @Getter
    @Setter
    public static class Remote {
        private Policy defaults = new Policy();
        private Map<String, Handler> handlers = new LinkedHashMap<>();

        @Getter
        @Setter
        public static class Handler {
            private String url;
            /**
             * Overrides the remote defaults for this handler when set.
             */
            private Policy policy;
        }

        @Getter
        @Setter
        public static class Policy {
            private int connectTimeoutMs = 2000;
            private int readTimeoutMs = 5000;
            private int maxAttempts = 2;
            private long initialBackoffMs = 200L;
            private long maxBackoffMs = 2000L;
            private double backoffMultiplier = 2.0d;
            private List<Integer> retryStatusCodes = new ArrayList<>(List.of(429, 502, 503, 504));
            private boolean retryOnIOException = true;
        }
    }

    @Getter
    @Setter
    public static class Response {
        private String component = "orchestrator";
    }
}
