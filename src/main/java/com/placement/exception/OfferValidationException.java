package com.placement.exception;

import com.placement.model.ErrorKind;

/**
 * Offer is structurally invalid (missing company, student without enrollment number, ...).
 */
public class OfferValidationException extends ReconciliationException {

    public OfferValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.VALIDATION;
    }
}
