package com.nosota.welfare.security;

import com.nosota.welfare.error.AccessDeniedException;
import com.nosota.welfare.model.AdminUser;
import com.nosota.welfare.model.ScopedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Combines the action permission check with the record scope check.
 *
 * <p>Global roles skip the permission lookup. Everyone else needs both the permission
 * and the record in scope. Denials carry a generic message only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGuard {

    private final PermissionService permissionService;
    private final ScopeResolver scopeResolver;

    /**
     * Authorizes an action on a specific record.
     *
     * @throws AccessDeniedException if the permission is missing or the record is out of scope
     */
    public void authorize(AdminUser user, String permissionName, ScopedRecord record,
                          PermissionContext context) {
        authorizeAction(user, permissionName, context);

        if (!scopeResolver.canAccess(user, record)) {
            log.warn("Access denied: user {} outside record scope", user.getId());
            throw new AccessDeniedException();
        }
    }

    /**
     * Authorizes an action not tied to an existing record (e.g. creating one).
     *
     * @throws AccessDeniedException if the user is inactive or lacks the permission
     */
    public void authorizeAction(AdminUser user, String permissionName, PermissionContext context) {
        if (user == null || !user.isActive() || user.getRole() == null) {
            throw new AccessDeniedException();
        }

        if (user.getRole().isGlobal()) {
            return;
        }

        if (!permissionService.hasPermission(user.getId(), permissionName, context)) {
            log.warn("Access denied: user {} lacks permission {}", user.getId(), permissionName);
            throw new AccessDeniedException();
        }
    }
}
