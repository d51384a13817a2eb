package com.placement.model;

/**
 * Classification of a per-offer failure.
 */
public enum ErrorKind {
    VALIDATION,
    STORE_UNAVAILABLE,
    CONCURRENT_MODIFICATION,
    UNEXPECTED
}
