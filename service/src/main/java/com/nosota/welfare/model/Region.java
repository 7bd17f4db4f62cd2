package com.nosota.welfare.model;

import com.nosota.welfare.api.model.RegionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Node of the administrative region tree ({@code state → district → area → unit}).
 *
 * <p>Regions are never removed: applications reference them permanently, so a region
 * is retired by clearing {@link #active}.
 */
@Entity
@Table(name = "region",
        uniqueConstraints = @UniqueConstraint(name = "uk_region_parent_code", columnNames = {"parent_id", "code"}),
        indexes = @Index(name = "idx_region_type_parent", columnList = "type, parent_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Region {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Upper-cased code, unique among the children of one parent.
     */
    @Column(name = "code", nullable = false, length = 50)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private RegionType type;

    /**
     * Parent region. Null only for {@link RegionType#STATE}.
     */
    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
