package com.nosota.welfare.error;

/**
 * Underlying persistence failure. Not retried internally; the caller decides.
 */
public class StoreException extends WelfareException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
