package com.nosota.welfare.security;

import com.nosota.welfare.api.model.RegionType;
import com.nosota.welfare.api.model.UserRole;
import com.nosota.welfare.model.AdminScope;
import com.nosota.welfare.model.AdminUser;
import com.nosota.welfare.model.ScopedRecord;
import com.nosota.welfare.service.RegionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Decides which records a user may read or modify.
 *
 * <p>SUPER_ADMIN and STATE_ADMIN are global. Regional admins are scoped by their
 * {@code adminScope.regions} set or, for users not yet migrated, by the single legacy
 * reference matching their level. Coordinators are scoped by project or scheme.
 *
 * <p>Neither method throws: missing or malformed scope data resolves to "no access".
 *
 * <p>Configuration:
 * <pre>
 * scope:
 *   include-descendants: false   # expand region scope to descendant regions
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScopeResolver {

    private final RegionService regionService;

    @Value("${scope.include-descendants:false}")
    private boolean includeDescendants;

    /**
     * Expands a user's configured scope into concrete id sets.
     *
     * @param user The user, may be null
     * @return Global scope for global roles, the configured ids otherwise, or
     * {@link ScopeSet#none()} for null, inactive or unscoped users
     */
    public ScopeSet resolveScope(AdminUser user) {
        try {
            if (user == null || !user.isActive() || user.getRole() == null) {
                return ScopeSet.none();
            }
            UserRole role = user.getRole();
            if (role.isGlobal()) {
                return ScopeSet.all();
            }

            AdminScope scope = user.getAdminScope();
            if (scope == null) {
                return ScopeSet.none();
            }

            return switch (role) {
                case DISTRICT_ADMIN, AREA_ADMIN, UNIT_ADMIN ->
                        ScopeSet.of(regionIdsOf(role, scope), Set.of(), Set.of());
                case PROJECT_COORDINATOR -> ScopeSet.of(Set.of(), nonNull(scope.getProjects()), Set.of());
                case SCHEME_COORDINATOR -> ScopeSet.of(Set.of(), Set.of(), nonNull(scope.getSchemes()));
                case BENEFICIARY, SUPER_ADMIN, STATE_ADMIN -> ScopeSet.none();
            };
        } catch (RuntimeException e) {
            log.error("Failed to resolve scope of user {}: {}", user.getId(), e.getMessage(), e);
            return ScopeSet.none();
        }
    }

    /**
     * Checks whether a record lies inside a user's scope.
     *
     * <p>Regional admins match on the record's reference at their own level, against
     * both the {@code regions} set and the legacy single reference. With descendant
     * expansion enabled, any of the record's region references may match. A record
     * without the checked reference is never accessible.
     *
     * @param user   The user, may be null
     * @param record The record, may be null
     * @return {@code true} if access is allowed
     */
    public boolean canAccess(AdminUser user, ScopedRecord record) {
        if (user == null || record == null || !user.isActive() || user.getRole() == null) {
            return false;
        }

        try {
            UserRole role = user.getRole();
            if (role.isGlobal()) {
                return true;
            }

            AdminScope scope = user.getAdminScope();
            if (scope == null) {
                return false;
            }

            return switch (role) {
                case DISTRICT_ADMIN, AREA_ADMIN, UNIT_ADMIN -> canAccessRegion(role, scope, record);
                case PROJECT_COORDINATOR -> contains(scope.getProjects(), record.getProjectId());
                case SCHEME_COORDINATOR -> contains(scope.getSchemes(), record.getSchemeId());
                case BENEFICIARY, SUPER_ADMIN, STATE_ADMIN -> false;
            };
        } catch (RuntimeException e) {
            log.error("Scope check failed for user {}: {}", user.getId(), e.getMessage(), e);
            return false;
        }
    }

    private boolean canAccessRegion(UserRole role, AdminScope scope, ScopedRecord record) {
        Set<UUID> allowed = new HashSet<>(nonNull(scope.getRegions()));
        UUID legacy = scope.legacyRegionAt(role.regionLevel());
        if (legacy != null) {
            allowed.add(legacy);
        }
        if (allowed.isEmpty()) {
            return false;
        }

        if (includeDescendants) {
            Set<UUID> expanded = expand(allowed);
            return Stream.of(record.getStateId(), record.getDistrictId(), record.getAreaId(), record.getUnitId())
                    .anyMatch(id -> id != null && expanded.contains(id));
        }

        return contains(allowed, recordRegionAt(role.regionLevel(), record));
    }

    private Set<UUID> regionIdsOf(UserRole role, AdminScope scope) {
        Set<UUID> regions = nonNull(scope.getRegions());
        if (regions.isEmpty()) {
            UUID legacy = scope.legacyRegionAt(role.regionLevel());
            regions = legacy == null ? Set.of() : Set.of(legacy);
        }
        return includeDescendants ? expand(regions) : regions;
    }

    private Set<UUID> expand(Set<UUID> regionIds) {
        Set<UUID> expanded = new HashSet<>(regionIds);
        for (UUID regionId : regionIds) {
            expanded.addAll(regionService.getDescendantIds(regionId));
        }
        return expanded;
    }

    private static UUID recordRegionAt(RegionType level, ScopedRecord record) {
        return switch (level) {
            case STATE -> record.getStateId();
            case DISTRICT -> record.getDistrictId();
            case AREA -> record.getAreaId();
            case UNIT -> record.getUnitId();
        };
    }

    private static boolean contains(Set<UUID> ids, UUID id) {
        return id != null && ids != null && ids.contains(id);
    }

    private static Set<UUID> nonNull(Set<UUID> ids) {
        return ids == null ? Set.of() : ids;
    }
}
