package com.nosota.welfare.model;

import java.util.UUID;

/**
 * A record carrying denormalized region, project and scheme references, copied at
 * creation time so scope checks need no joins.
 */
public interface ScopedRecord {

    UUID getStateId();

    UUID getDistrictId();

    UUID getAreaId();

    UUID getUnitId();

    UUID getProjectId();

    UUID getSchemeId();
}
