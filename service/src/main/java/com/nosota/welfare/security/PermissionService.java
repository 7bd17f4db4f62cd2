package com.nosota.welfare.security;

import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.RecordNotFoundException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.Permission;
import com.nosota.welfare.model.RoleDefinition;
import com.nosota.welfare.model.UserRoleAssignment;
import com.nosota.welfare.repository.PermissionRepository;
import com.nosota.welfare.repository.RoleDefinitionRepository;
import com.nosota.welfare.repository.UserRoleAssignmentRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Coarse-grained action permissions (e.g. {@code reports.create}).
 *
 * <p>A user's permissions are the union, over all effective role assignments, of the
 * role's active permissions plus the assignment's additional permissions minus its
 * restricted ones. Region scope is checked separately by {@link ScopeResolver}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final RoleDefinitionRepository roleDefinitionRepository;
    private final UserRoleAssignmentRepository assignmentRepository;
    private final Clock clock;

    /**
     * Checks whether a user holds a permission and the permission's conditions hold for
     * the given request context.
     *
     * <p>Unknown or inactive permissions are never granted. Store failures deny access.
     *
     * @param userId         The user
     * @param permissionName Permission name
     * @param context        Request attributes, may be null
     * @return {@code true} if granted
     */
    public boolean hasPermission(UUID userId, String permissionName, PermissionContext context) {
        if (userId == null || permissionName == null || permissionName.isBlank()) {
            return false;
        }

        try {
            Optional<Permission> permission = permissionRepository.findByNameAndActiveTrue(permissionName);
            if (permission.isEmpty()) {
                log.debug("Permission {} unknown or inactive", permissionName);
                return false;
            }

            if (!getUserPermissions(userId).contains(permissionName)) {
                return false;
            }

            return conditionsHold(permission.get(), context);
        } catch (RuntimeException e) {
            log.error("Permission check failed: user={}, permission={}: {}",
                    userId, permissionName, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Effective permission names of a user at the current time.
     */
    public Set<String> getUserPermissions(@NotNull UUID userId) {
        List<UserRoleAssignment> assignments =
                assignmentRepository.findEffectiveAssignments(userId, LocalDateTime.now(clock));

        Set<String> permissions = new HashSet<>();
        for (UserRoleAssignment assignment : assignments) {
            Set<String> granted = new HashSet<>();
            for (Permission permission : assignment.getRole().getPermissions()) {
                if (permission.isActive()) {
                    granted.add(permission.getName());
                }
            }
            if (assignment.getAdditionalPermissions() != null) {
                granted.addAll(assignment.getAdditionalPermissions());
            }
            if (assignment.getRestrictedPermissions() != null) {
                granted.removeAll(assignment.getRestrictedPermissions());
            }
            permissions.addAll(granted);
        }
        return permissions;
    }

    /**
     * Assigns a role to a user.
     *
     * @param userId     The user
     * @param roleName   Role definition name
     * @param assignedBy Acting admin
     * @param validUntil End of validity, or null for a permanent assignment
     * @param reason     Free-form reason
     * @return The new assignment
     * @throws RecordNotFoundException if the role does not exist
     * @throws InvalidStateException   if the role is inactive or already assigned
     * @throws ValidationException     if {@code validUntil} is not in the future
     */
    @Transactional
    public UserRoleAssignment assignRole(@NotNull UUID userId, @NotBlank String roleName,
                                         @NotNull UUID assignedBy, LocalDateTime validUntil,
                                         String reason) {
        RoleDefinition role = roleDefinitionRepository.findByName(roleName)
                .orElseThrow(() -> new RecordNotFoundException("Role"));

        if (!role.isActive()) {
            throw new InvalidStateException("Role is inactive");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (validUntil != null && !validUntil.isAfter(now)) {
            throw new ValidationException("validUntil", "must be in the future");
        }

        if (!assignmentRepository.findByUserIdAndRoleNameAndActiveTrue(userId, roleName).isEmpty()) {
            throw new InvalidStateException("Role already assigned to user");
        }

        boolean primary = assignmentRepository.findEffectiveAssignments(userId, now).isEmpty();

        UserRoleAssignment assignment = new UserRoleAssignment();
        assignment.setUserId(userId);
        assignment.setRole(role);
        assignment.setValidFrom(now);
        assignment.setValidUntil(validUntil);
        assignment.setActive(true);
        assignment.setPrimaryRole(primary);
        assignment.setAssignedBy(assignedBy);
        assignment.setAssignmentReason(reason);

        assignment = assignmentRepository.save(assignment);

        log.info("Role assigned: user={}, role={}, primary={}, validUntil={}, by={}",
                userId, roleName, primary, validUntil, assignedBy);

        return assignment;
    }

    /**
     * Revokes every active assignment of a role to a user.
     *
     * @return Number of revoked assignments
     * @throws RecordNotFoundException if the user has no active assignment of the role
     */
    @Transactional
    public int revokeRole(@NotNull UUID userId, @NotBlank String roleName, @NotNull UUID revokedBy) {
        List<UserRoleAssignment> assignments =
                assignmentRepository.findByUserIdAndRoleNameAndActiveTrue(userId, roleName);
        if (assignments.isEmpty()) {
            throw new RecordNotFoundException("Role assignment");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        for (UserRoleAssignment assignment : assignments) {
            assignment.setActive(false);
            assignment.setRevokedBy(revokedBy);
            assignment.setRevokedAt(now);
        }
        assignmentRepository.saveAll(assignments);

        log.info("Role revoked: user={}, role={}, assignments={}, by={}",
                userId, roleName, assignments.size(), revokedBy);

        return assignments.size();
    }

    /**
     * Deactivates assignments whose validity has ended.
     *
     * @return Number of deactivated assignments
     */
    @Transactional
    public int cleanupExpiredAssignments() {
        int count = assignmentRepository.deactivateExpired(LocalDateTime.now(clock));
        if (count > 0) {
            log.info("Deactivated {} expired role assignments", count);
        }
        return count;
    }

    private boolean conditionsHold(Permission permission, PermissionContext context) {
        LocalDateTime timestamp = context != null && context.timestamp() != null
                ? context.timestamp()
                : LocalDateTime.now(clock);
        String ip = context != null ? context.ipAddress() : null;

        Integer start = permission.getAllowedHourStart();
        Integer end = permission.getAllowedHourEnd();
        if (start != null && end != null) {
            int hour = timestamp.getHour();
            boolean inWindow = start <= end
                    ? hour >= start && hour <= end
                    : hour >= start || hour <= end;
            if (!inWindow) {
                log.warn("Permission {} used outside allowed hours {}-{}", permission.getName(), start, end);
                return false;
            }
        }

        Set<DayOfWeek> days = permission.getAllowedDays();
        if (days != null && !days.isEmpty() && !days.contains(timestamp.getDayOfWeek())) {
            log.warn("Permission {} used on disallowed day {}", permission.getName(), timestamp.getDayOfWeek());
            return false;
        }

        Set<String> blocked = permission.getBlockedIps();
        if (ip != null && blocked != null && blocked.contains(ip)) {
            log.warn("Permission {} used from blocked address", permission.getName());
            return false;
        }

        Set<String> allowed = permission.getAllowedIps();
        if (allowed != null && !allowed.isEmpty() && (ip == null || !allowed.contains(ip))) {
            log.warn("Permission {} used from address outside allow list", permission.getName());
            return false;
        }

        return true;
    }
}
