package com.nosota.welfare.service;

import com.nosota.welfare.api.model.UserRole;
import com.nosota.welfare.error.AccessDeniedException;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.RecordNotFoundException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.AdminScope;
import com.nosota.welfare.model.AdminUser;
import com.nosota.welfare.repository.AdminUserRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Administrative user lifecycle.
 *
 * <p>Every operation is checked against the role hierarchy: an actor may only create,
 * reassign or deactivate users whose role it can manage ({@link UserRole#canManage}).
 * A regional actor is also bounded by its own subtree: the regions of every user it
 * touches must lie within it ({@link RegionService#isWithinScope}). Users are never deleted.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminUserService {

    private final AdminUserRepository adminUserRepository;
    private final RegionService regionService;
    private final Clock clock;

    /**
     * Creates an admin user. Legacy single-region references in {@code scope} are folded
     * into the regions set on the way in.
     *
     * @throws AccessDeniedException if the actor cannot manage {@code role}, or the scope
     *                               assigns regions outside the actor's own
     * @throws ValidationException   if required fields are missing, the phone is taken,
     *                               or a regional role has no region
     */
    @Transactional
    public AdminUser createUser(AdminUser actor, String name, String phone,
                                @NotNull UserRole role, AdminScope scope) {
        requireManager(actor, role);

        Map<String, String> errors = new LinkedHashMap<>();
        if (name == null || name.isBlank()) {
            errors.put("name", "is required");
        }
        if (phone == null || phone.isBlank()) {
            errors.put("phone", "is required");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        if (adminUserRepository.existsByPhone(phone.trim())) {
            throw new ValidationException("phone", "is already registered");
        }

        AdminScope normalized = normalizedScope(role, scope);
        validateScope(role, normalized);
        requireWithinScope(actor, normalized);

        LocalDateTime now = LocalDateTime.now(clock);
        AdminUser user = new AdminUser();
        user.setName(name.trim());
        user.setPhone(phone.trim());
        user.setRole(role);
        user.setAdminScope(normalized);
        user.setActive(true);
        user.setCreatedBy(actor.getId());
        user.setCreatedAt(now);
        user.setUpdatedAt(now);

        user = adminUserRepository.save(user);

        log.info("Admin user created: id={}, role={}, by={}", user.getId(), role, actor.getId());
        return user;
    }

    /**
     * Changes a user's role and replaces its scope.
     *
     * @throws AccessDeniedException if the actor cannot manage the current or the new role,
     *                               or either scope lies outside the actor's own
     */
    @Transactional
    public AdminUser reassignRole(AdminUser actor, @NotNull UUID userId,
                                  @NotNull UserRole role, AdminScope scope) {
        AdminUser user = getUser(userId);
        requireManager(actor, user.getRole());
        requireManager(actor, role);
        requireWithinScope(actor, normalizedScope(user.getRole(), user.getAdminScope()));

        AdminScope normalized = normalizedScope(role, scope);
        validateScope(role, normalized);
        requireWithinScope(actor, normalized);

        UserRole previous = user.getRole();
        user.setRole(role);
        user.setAdminScope(normalized);
        user.setUpdatedAt(LocalDateTime.now(clock));

        user = adminUserRepository.save(user);

        log.info("Admin user role reassigned: id={}, {} → {}, by={}", userId, previous, role, actor.getId());
        return user;
    }

    @Transactional
    public AdminUser deactivateUser(AdminUser actor, @NotNull UUID userId) {
        AdminUser user = getUser(userId);
        requireManager(actor, user.getRole());
        requireWithinScope(actor, normalizedScope(user.getRole(), user.getAdminScope()));

        if (user.getId().equals(actor.getId())) {
            throw new InvalidStateException("Users cannot deactivate themselves");
        }
        if (!user.isActive()) {
            log.debug("Admin user {} already inactive", userId);
            return user;
        }

        user.setActive(false);
        user.setUpdatedAt(LocalDateTime.now(clock));
        user = adminUserRepository.save(user);

        log.info("Admin user deactivated: id={}, by={}", userId, actor.getId());
        return user;
    }

    public AdminUser getUser(@NotNull UUID userId) {
        return adminUserRepository.findById(userId)
                .orElseThrow(() -> new RecordNotFoundException("User"));
    }

    /**
     * Migrates users still carrying legacy single district/area/unit references.
     *
     * <p>The reference matching the user's role level is added to the regions set.
     * All legacy references are then cleared, since no scope decision reads the ones
     * that do not match the role. Running it again finds nothing to migrate.
     *
     * @return Number of migrated users
     */
    @Transactional
    public int normalizeLegacyScopes() {
        List<AdminUser> users = adminUserRepository.findWithLegacyScope();
        LocalDateTime now = LocalDateTime.now(clock);

        for (AdminUser user : users) {
            user.setAdminScope(normalizedScope(user.getRole(), user.getAdminScope()));
            user.setUpdatedAt(now);
        }
        adminUserRepository.saveAll(users);

        log.info("Normalized legacy scope of {} admin users", users.size());
        return users.size();
    }

    static AdminScope normalizedScope(UserRole role, AdminScope scope) {
        AdminScope normalized = new AdminScope();
        if (scope == null) {
            return normalized;
        }

        if (scope.getRegions() != null) {
            normalized.setRegions(new HashSet<>(scope.getRegions()));
        }
        if (scope.getProjects() != null) {
            normalized.setProjects(new HashSet<>(scope.getProjects()));
        }
        if (scope.getSchemes() != null) {
            normalized.setSchemes(new HashSet<>(scope.getSchemes()));
        }

        UUID legacy = role == null ? null : scope.legacyRegionAt(role.regionLevel());
        if (legacy != null) {
            normalized.getRegions().add(legacy);
        }
        return normalized;
    }

    private static void validateScope(UserRole role, AdminScope scope) {
        switch (role) {
            case DISTRICT_ADMIN, AREA_ADMIN, UNIT_ADMIN -> {
                if (scope.getRegions().isEmpty()) {
                    throw new ValidationException("adminScope.regions", "is required for " + role);
                }
            }
            case PROJECT_COORDINATOR -> {
                if (scope.getProjects().isEmpty()) {
                    throw new ValidationException("adminScope.projects", "is required for " + role);
                }
            }
            case SCHEME_COORDINATOR -> {
                if (scope.getSchemes().isEmpty()) {
                    throw new ValidationException("adminScope.schemes", "is required for " + role);
                }
            }
            case SUPER_ADMIN, STATE_ADMIN, BENEFICIARY -> {
            }
        }
    }

    private void requireWithinScope(AdminUser actor, AdminScope scope) {
        if (!regionService.isWithinScope(actor, scope.getRegions())) {
            log.warn("User {} tried to assign regions outside its scope: {}", actor.getId(), scope.getRegions());
            throw new AccessDeniedException();
        }
    }

    private static void requireManager(AdminUser actor, UserRole target) {
        if (actor == null || !actor.isActive() || actor.getRole() == null
                || !actor.getRole().canManage(target)) {
            throw new AccessDeniedException();
        }
    }
}
