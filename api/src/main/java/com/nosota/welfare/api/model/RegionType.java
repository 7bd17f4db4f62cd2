package com.nosota.welfare.api.model;

/**
 * Level of a node in the administrative region tree.
 *
 * <p>The tree is strict: {@code STATE → DISTRICT → AREA → UNIT}. A region's parent
 * must always be exactly one level above it, so cycles cannot be expressed.
 */
public enum RegionType {
    STATE(1),
    DISTRICT(2),
    AREA(3),
    UNIT(4);

    private final int level;

    RegionType(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Type the parent of a region of this type must have.
     *
     * @return parent type, or {@code null} for {@link #STATE}
     */
    public RegionType parentType() {
        return switch (this) {
            case STATE -> null;
            case DISTRICT -> STATE;
            case AREA -> DISTRICT;
            case UNIT -> AREA;
        };
    }
}
