package com.placement.exception;

import com.placement.model.ErrorKind;

/**
 * Conditional write kept losing to concurrent writers until the attempt limit ran out.
 */
public class ConcurrentRecordModificationException extends ReconciliationException {

    private final String recordId;
    private final int attempts;

    public ConcurrentRecordModificationException(String recordId, int attempts) {
        super("Record " + recordId + " was modified concurrently on each of " + attempts + " attempts");
        this.recordId = recordId;
        this.attempts = attempts;
    }

    public String getRecordId() {
        return recordId;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.CONCURRENT_MODIFICATION;
    }
}
