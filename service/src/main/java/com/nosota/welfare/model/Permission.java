package com.nosota.welfare.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.DayOfWeek;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Coarse-grained action permission, e.g. {@code recurring_payments.update}.
 *
 * <p>A permission may carry conditions restricting when and from where it can be
 * exercised. Empty or null conditions mean "no restriction".
 */
@Entity
@Table(name = "permission")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Permission {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "module", nullable = false, length = 50)
    private String module;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active;

    /**
     * First hour of the day (0-23, inclusive) the permission may be used.
     */
    @Column(name = "allowed_hour_start")
    private Integer allowedHourStart;

    /**
     * Last hour of the day (0-23, inclusive) the permission may be used.
     */
    @Column(name = "allowed_hour_end")
    private Integer allowedHourEnd;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "permission_allowed_day", joinColumns = @JoinColumn(name = "permission_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private Set<DayOfWeek> allowedDays = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "permission_allowed_ip", joinColumns = @JoinColumn(name = "permission_id"))
    @Column(name = "ip_address", nullable = false, length = 45)
    private Set<String> allowedIps = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "permission_blocked_ip", joinColumns = @JoinColumn(name = "permission_id"))
    @Column(name = "ip_address", nullable = false, length = 45)
    private Set<String> blockedIps = new HashSet<>();
}
