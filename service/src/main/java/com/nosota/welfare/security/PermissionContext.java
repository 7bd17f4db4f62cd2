package com.nosota.welfare.security;

import java.time.LocalDateTime;

/**
 * Request attributes a permission's conditions are evaluated against.
 *
 * @param ipAddress Client address, may be null
 * @param timestamp Time of the request, may be null (then "now" is used)
 */
public record PermissionContext(
        String ipAddress,
        LocalDateTime timestamp
) {
    public static PermissionContext empty() {
        return new PermissionContext(null, null);
    }
}
