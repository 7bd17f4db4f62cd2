package com.nosota.welfare.error;

/**
 * Scope or permission check failed.
 *
 * <p>The message is deliberately generic and never names the required permission.
 */
public class AccessDeniedException extends WelfareException {

    public AccessDeniedException() {
        super("Access denied");
    }
}
