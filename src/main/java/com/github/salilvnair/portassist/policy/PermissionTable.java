package com.github.salilvnair.portassist.policy;

import com.github.salilvnair.portassist.intent.Intent;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role permissions as code. Only {@link AccessPolicy} consults these tables.
 */
public final class PermissionTable {

    private static final Map<Role, Set<Intent>> ROLE_PERMISSIONS;
    private static final Set<Intent> REQUIRE_AUTH;
    private static final Set<Intent> REQUIRE_OWNERSHIP;

    static {
        Set<Intent> business = Arrays.stream(Intent.values())
                .filter(i -> !i.isMeta())
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Intent.class)));

        Set<Intent> staff = EnumSet.copyOf(business);
        staff.add(Intent.HELP);
        staff.add(Intent.SMALLTALK);

        Map<Role, Set<Intent>> permissions = new EnumMap<>(Role.class);
        permissions.put(Role.ADMIN, Collections.unmodifiableSet(EnumSet.copyOf(staff)));
        permissions.put(Role.OPERATOR, Collections.unmodifiableSet(EnumSet.copyOf(staff)));
        permissions.put(Role.CARRIER, Collections.unmodifiableSet(EnumSet.of(
                Intent.BOOKING_STATUS,
                Intent.SLOT_AVAILABILITY,
                Intent.SLOT_RECOMMENDATION,
                Intent.PASSAGE_HISTORY,
                Intent.CARRIER_SCORE,
                Intent.HELP,
                Intent.SMALLTALK
        )));
        permissions.put(Role.ANON, Collections.unmodifiableSet(EnumSet.of(
                Intent.SLOT_AVAILABILITY,
                Intent.HELP,
                Intent.SMALLTALK
        )));
        ROLE_PERMISSIONS = Collections.unmodifiableMap(permissions);

        Set<Intent> requireAuth = EnumSet.copyOf(business);
        requireAuth.remove(Intent.SLOT_AVAILABILITY);
        REQUIRE_AUTH = Collections.unmodifiableSet(requireAuth);

        REQUIRE_OWNERSHIP = Collections.unmodifiableSet(EnumSet.of(
                Intent.BOOKING_STATUS,
                Intent.CARRIER_SCORE,
                Intent.PASSAGE_HISTORY
        ));
    }

    private PermissionTable() {
    }

    public static boolean isAllowed(Role role, Intent intent) {
        return ROLE_PERMISSIONS.getOrDefault(role, Set.of()).contains(intent);
    }

    public static boolean requiresAuth(Intent intent) {
        return REQUIRE_AUTH.contains(intent);
    }

    public static boolean requiresOwnership(Intent intent) {
        return REQUIRE_OWNERSHIP.contains(intent);
    }

    /**
     * Intent codes the role may use, sorted by code.
     */
    public static List<String> allowedIntents(Role role) {
        return ROLE_PERMISSIONS.getOrDefault(role, Set.of()).stream()
                .map(Intent::code)
                .sorted()
                .toList();
    }

    /**
     * Least privileged role granted the intent.
     */
    public static Optional<Role> lowestRoleGranting(Intent intent) {
        for (Role role : Role.values()) {
            if (isAllowed(role, intent)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
