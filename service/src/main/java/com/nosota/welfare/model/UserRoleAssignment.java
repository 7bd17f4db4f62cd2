package com.nosota.welfare.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Assignment of a {@link RoleDefinition} to a user.
 *
 * <p>Effective permissions of one assignment are the role's permissions, plus
 * {@link #additionalPermissions}, minus {@link #restrictedPermissions}. An assignment
 * counts only while active and within {@code [validFrom, validUntil)}.
 */
@Entity
@Table(name = "user_role_assignment",
        indexes = @Index(name = "idx_user_role_assignment_user", columnList = "user_id, active"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UserRoleAssignment {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private RoleDefinition role;

    /**
     * Permission names granted on top of the role.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_role_additional_permission", joinColumns = @JoinColumn(name = "assignment_id"))
    @Column(name = "permission_name", nullable = false, length = 100)
    private Set<String> additionalPermissions = new HashSet<>();

    /**
     * Permission names withdrawn from the role for this user.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_role_restricted_permission", joinColumns = @JoinColumn(name = "assignment_id"))
    @Column(name = "permission_name", nullable = false, length = 100)
    private Set<String> restrictedPermissions = new HashSet<>();

    @Column(name = "valid_from", nullable = false)
    private LocalDateTime validFrom;

    /**
     * End of validity; null means permanent.
     */
    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "primary_role", nullable = false)
    private boolean primaryRole;

    @Column(name = "assigned_by", nullable = false)
    private UUID assignedBy;

    @Column(name = "assignment_reason", length = 500)
    private String assignmentReason;

    @Column(name = "revoked_by")
    private UUID revokedBy;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;
}
