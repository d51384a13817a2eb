package com.placement.exception;

import com.placement.model.ErrorKind;

/**
 * The record store could not be reached or did not answer in time.
 */
public class StoreUnavailableException extends ReconciliationException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.STORE_UNAVAILABLE;
    }
}
