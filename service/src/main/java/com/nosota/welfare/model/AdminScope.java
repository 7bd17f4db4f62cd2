package com.nosota.welfare.model;

import com.nosota.welfare.api.model.RegionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Administrative scope of a user.
 *
 * <p>Two shapes coexist: the {@link #regions} set, and the older single
 * {@link #districtId}/{@link #areaId}/{@link #unitId} references that some users were
 * created with. {@code AdminUserService.normalizeLegacyScopes()} folds the latter into
 * the former.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AdminScope {

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "admin_scope_region", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "region_id", nullable = false)
    private Set<UUID> regions = new HashSet<>();

    @Column(name = "scope_district_id")
    private UUID districtId;

    @Column(name = "scope_area_id")
    private UUID areaId;

    @Column(name = "scope_unit_id")
    private UUID unitId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "admin_scope_project", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "project_id", nullable = false)
    private Set<UUID> projects = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "admin_scope_scheme", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "scheme_id", nullable = false)
    private Set<UUID> schemes = new HashSet<>();

    /**
     * Legacy single reference at the given level.
     *
     * @return the reference, or {@code null} when unset or for {@link RegionType#STATE}
     */
    public UUID legacyRegionAt(RegionType level) {
        if (level == null) {
            return null;
        }
        return switch (level) {
            case DISTRICT -> districtId;
            case AREA -> areaId;
            case UNIT -> unitId;
            case STATE -> null;
        };
    }
}
