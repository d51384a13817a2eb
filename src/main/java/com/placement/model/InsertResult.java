package com.placement.model;

/**
 * Outcome of inserting a new record. {@code ALREADY_EXISTS} means a document with the
 * same id is already stored, typically because an earlier attempt did succeed.
 */
public record InsertResult(
    Status status,
    String id
) {
    public enum Status {
        INSERTED,
        ALREADY_EXISTS
    }

    public static InsertResult inserted(String id) {
        return new InsertResult(Status.INSERTED, id);
    }

    public static InsertResult alreadyExists(String id) {
        return new InsertResult(Status.ALREADY_EXISTS, id);
    }
}
