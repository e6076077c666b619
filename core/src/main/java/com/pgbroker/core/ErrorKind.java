package com.pgbroker.core;

/**
 * Categories of failure reported by the broker. Tool handlers surface the
 * lower-case name as the {@code kind} of a structured error.
 */
public enum ErrorKind {
    /** The broker, a channel view or a table is missing. */
    PRECONDITION,
    /** A channel, policy or subscription that must exist does not. */
    NOT_FOUND,
    /** Rejected before any database call. */
    VALIDATION,
    /** A multi-statement operation failed and was rolled back in full. */
    TRANSACTION,
    /** The database reported an error for a single statement. */
    BACKEND;

    public String label() {
        return name().toLowerCase();
    }
}
