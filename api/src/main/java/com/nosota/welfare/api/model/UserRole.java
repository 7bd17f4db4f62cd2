package com.nosota.welfare.api.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of user roles.
 *
 * <p>Every scope decision switches over this enum exhaustively, so adding a role
 * fails compilation at each decision site until it is handled there.
 */
public enum UserRole {
    SUPER_ADMIN,
    STATE_ADMIN,
    DISTRICT_ADMIN,
    AREA_ADMIN,
    UNIT_ADMIN,
    PROJECT_COORDINATOR,
    SCHEME_COORDINATOR,
    BENEFICIARY;

    /**
     * Global roles see every region and never consult a region list.
     */
    public boolean isGlobal() {
        return switch (this) {
            case SUPER_ADMIN, STATE_ADMIN -> true;
            case DISTRICT_ADMIN, AREA_ADMIN, UNIT_ADMIN,
                 PROJECT_COORDINATOR, SCHEME_COORDINATOR, BENEFICIARY -> false;
        };
    }

    /**
     * Region level a regional admin is scoped at.
     *
     * @return region level, or {@code null} for roles that are not region-scoped
     */
    public RegionType regionLevel() {
        return switch (this) {
            case DISTRICT_ADMIN -> RegionType.DISTRICT;
            case AREA_ADMIN -> RegionType.AREA;
            case UNIT_ADMIN -> RegionType.UNIT;
            case SUPER_ADMIN, STATE_ADMIN, PROJECT_COORDINATOR,
                 SCHEME_COORDINATOR, BENEFICIARY -> null;
        };
    }

    /**
     * Roles allowed to create or edit regions.
     */
    public boolean canManageRegions() {
        return switch (this) {
            case SUPER_ADMIN, STATE_ADMIN, DISTRICT_ADMIN -> true;
            case AREA_ADMIN, UNIT_ADMIN, PROJECT_COORDINATOR,
                 SCHEME_COORDINATOR, BENEFICIARY -> false;
        };
    }

    /**
     * Roles a user with this role may create, reassign or deactivate.
     */
    public Set<UserRole> manageableRoles() {
        return switch (this) {
            case SUPER_ADMIN -> EnumSet.allOf(UserRole.class);
            case STATE_ADMIN -> EnumSet.of(DISTRICT_ADMIN, AREA_ADMIN, UNIT_ADMIN,
                    PROJECT_COORDINATOR, SCHEME_COORDINATOR, BENEFICIARY);
            case DISTRICT_ADMIN -> EnumSet.of(AREA_ADMIN, UNIT_ADMIN, BENEFICIARY);
            case AREA_ADMIN -> EnumSet.of(UNIT_ADMIN, BENEFICIARY);
            case UNIT_ADMIN -> EnumSet.of(BENEFICIARY);
            case PROJECT_COORDINATOR, SCHEME_COORDINATOR, BENEFICIARY -> EnumSet.noneOf(UserRole.class);
        };
    }

    public boolean canManage(UserRole target) {
        return target != null && manageableRoles().contains(target);
    }
}
