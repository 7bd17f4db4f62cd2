package com.nosota.welfare.error;

/**
 * Operation is not legal for the record's current status.
 */
public class InvalidStateException extends WelfareException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
