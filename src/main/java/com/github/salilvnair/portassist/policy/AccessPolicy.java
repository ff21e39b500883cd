package com.github.salilvnair.portassist.policy;

import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.entity.EntityKeyConstants;
import com.github.salilvnair.portassist.intent.Intent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role based gate in front of dispatch. Checks run in a fixed order: meta
 * intents, authentication, role permission, then the carrier ownership check.
 * Never throws; every outcome is an {@link AccessDecision}.
 */
@Component
public class AccessPolicy {

    public static final String AUTH_REQUIRED_REASON = "Authentication required for this feature";
    public static final String AUTHENTICATED = "authenticated";

    public AccessDecision evaluate(Intent intent, Role role, boolean authPresent, EntityBag entities, String ownCarrierId) {
        EntityBag bag = entities == null ? EntityBag.empty() : entities;

        if (intent.isMeta()) {
            return AccessDecision.allow(
                    AccessDecision.Code.PUBLIC_INTENT,
                    "Public intent",
                    false,
                    Map.of("intent", intent.code())
            );
        }

        if (PermissionTable.requiresAuth(intent) && !authPresent) {
            return AccessDecision.deny(
                    AccessDecision.STATUS_UNAUTHORIZED,
                    AccessDecision.Code.MISSING_AUTH,
                    AUTH_REQUIRED_REASON,
                    AUTHENTICATED,
                    Map.of("intent", intent.code())
            );
        }

        if (!PermissionTable.isAllowed(role, intent)) {
            String requiredRole = PermissionTable.lowestRoleGranting(intent)
                    .map(Role::name)
                    .orElse(null);
            return AccessDecision.deny(
                    AccessDecision.STATUS_FORBIDDEN,
                    AccessDecision.Code.INSUFFICIENT_ROLE,
                    "Role '" + role.name() + "' does not have permission for '" + intent.code() + "'",
                    requiredRole,
                    Map.of("intent", intent.code(), "user_role", role.name())
            );
        }

        if (role == Role.CARRIER && PermissionTable.requiresOwnership(intent)) {
            return checkOwnership(intent, bag, ownCarrierId);
        }

        return granted(intent, role);
    }

    public List<String> allowedIntents(Role role) {
        return PermissionTable.allowedIntents(role);
    }

    private AccessDecision checkOwnership(Intent intent, EntityBag entities, String ownCarrierId) {
        if (intent != Intent.CARRIER_SCORE) {
            // bookings and passages can only be attributed by the owning service
            return deferred(intent, Map.of("deferred", intent.code() + "_ownership"));
        }

        String requested = entities.getString(EntityKeyConstants.CARRIER_ID);
        if (requested == null || requested.isBlank()) {
            return AccessDecision.allow(
                    AccessDecision.Code.GRANTED,
                    "Checking own carrier score",
                    false,
                    Map.of("intent", intent.code(), "implicit_ownership", true)
            );
        }
        if (ownCarrierId == null || ownCarrierId.isBlank()) {
            return deferred(intent, Map.of("requested_carrier", requested));
        }
        if (requested.equals(ownCarrierId.trim())) {
            return AccessDecision.allow(
                    AccessDecision.Code.GRANTED,
                    "Checking own carrier score",
                    false,
                    Map.of("intent", intent.code(), "verified_ownership", true)
            );
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", intent.code());
        metadata.put("requested_carrier", requested);
        metadata.put("own_carrier", ownCarrierId);
        return AccessDecision.deny(
                AccessDecision.STATUS_FORBIDDEN,
                AccessDecision.Code.OWNERSHIP_CHECK_FAILED,
                "Cannot access other carriers' scores",
                null,
                metadata
        );
    }

    private AccessDecision deferred(Intent intent, Map<String, Object> extra) {
        Map<String, Object> metadata = new LinkedHashMap<>(extra);
        metadata.put("intent", intent.code());
        return AccessDecision.allow(
                AccessDecision.Code.OWNERSHIP_DEFERRED,
                "Ownership check deferred to the owning service",
                true,
                metadata
        );
    }

    private AccessDecision granted(Intent intent, Role role) {
        return AccessDecision.allow(
                AccessDecision.Code.GRANTED,
                "Access granted",
                false,
                Map.of("intent", intent.code(), "user_role", role.name())
        );
    }
}
