package com.placement.exception;

import com.placement.model.ErrorKind;

/**
 * Base class for failures that map onto an {@link ErrorKind}.
 */
public abstract class ReconciliationException extends RuntimeException {

    protected ReconciliationException(String message) {
        super(message);
    }

    protected ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();
}
