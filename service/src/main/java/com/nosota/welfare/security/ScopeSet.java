package com.nosota.welfare.security;

import java.util.Set;
import java.util.UUID;

/**
 * Effective scope of a user.
 *
 * <p>A global scope carries empty id sets and means "no filter applied". A non-global
 * scope with all sets empty grants nothing.
 *
 * @param regionIds  Region ids the user may act on
 * @param projectIds Project ids (project coordinators)
 * @param schemeIds  Scheme ids (scheme coordinators)
 * @param global     Whether the user sees every region
 */
public record ScopeSet(
        Set<UUID> regionIds,
        Set<UUID> projectIds,
        Set<UUID> schemeIds,
        boolean global
) {
    private static final ScopeSet GLOBAL = new ScopeSet(Set.of(), Set.of(), Set.of(), true);
    private static final ScopeSet NONE = new ScopeSet(Set.of(), Set.of(), Set.of(), false);

    public ScopeSet {
        regionIds = Set.copyOf(regionIds);
        projectIds = Set.copyOf(projectIds);
        schemeIds = Set.copyOf(schemeIds);
    }

    public static ScopeSet all() {
        return GLOBAL;
    }

    public static ScopeSet none() {
        return NONE;
    }

    public static ScopeSet of(Set<UUID> regionIds, Set<UUID> projectIds, Set<UUID> schemeIds) {
        return new ScopeSet(regionIds, projectIds, schemeIds, false);
    }

    public boolean grantsNothing() {
        return !global && regionIds.isEmpty() && projectIds.isEmpty() && schemeIds.isEmpty();
    }
}
