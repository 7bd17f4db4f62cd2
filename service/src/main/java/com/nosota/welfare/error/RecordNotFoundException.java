package com.nosota.welfare.error;

/**
 * Referenced record does not exist.
 *
 * <p>The message names the record kind only, never the id, so callers cannot tell a
 * malformed id from a missing record.
 */
public class RecordNotFoundException extends WelfareException {

    public RecordNotFoundException(String recordKind) {
        super(recordKind + " not found");
    }
}
