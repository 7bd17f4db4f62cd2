package com.nosota.welfare.error;

/**
 * Base class of the service's error taxonomy.
 *
 * <p>Unchecked, so that a failure inside a transactional operation rolls the
 * whole operation back.
 */
public abstract class WelfareException extends RuntimeException {

    protected WelfareException(String message) {
        super(message);
    }

    protected WelfareException(String message, Throwable cause) {
        super(message, cause);
    }
}
