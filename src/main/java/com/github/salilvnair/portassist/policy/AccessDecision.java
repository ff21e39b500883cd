package com.github.salilvnair.portassist.policy;

import java.util.Map;

public record AccessDecision(
        boolean allowed,
        int httpStatus,
        String reason,
        String requiredRole,
        boolean needsDownstreamOwnershipCheck,
        Code code,
        Map<String, Object> metadata
) {

    public static final int STATUS_OK = 200;
    public static final int STATUS_UNAUTHORIZED = 401;
    public static final int STATUS_FORBIDDEN = 403;

    public AccessDecision {
        if (!allowed) {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("denied decision requires a reason");
            }
            if (httpStatus != STATUS_UNAUTHORIZED && httpStatus != STATUS_FORBIDDEN) {
                throw new IllegalArgumentException("denied decision requires status 401 or 403: " + httpStatus);
            }
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AccessDecision allow(Code code, String reason, boolean needsDownstreamOwnershipCheck, Map<String, Object> metadata) {
        return new AccessDecision(true, STATUS_OK, reason, null, needsDownstreamOwnershipCheck, code, metadata);
    }

    public static AccessDecision deny(int httpStatus, Code code, String reason, String requiredRole, Map<String, Object> metadata) {
        return new AccessDecision(false, httpStatus, reason, requiredRole, false, code, metadata);
    }

    public enum Code {
        PUBLIC_INTENT("public_intent"),
        MISSING_AUTH("missing_auth"),
        INSUFFICIENT_ROLE("insufficient_role"),
        OWNERSHIP_CHECK_FAILED("ownership_check_failed"),
        OWNERSHIP_DEFERRED("ownership_deferred"),
        GRANTED("granted");

        private final String value;

        Code(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
