package com.placement.model;

/**
 * Offer that could not be reconciled, with enough context to replay it.
 */
public record FailedOffer(
    Offer offer,
    ErrorKind errorKind,
    String errorMessage,
    String exceptionType,
    int attempts
) {}
