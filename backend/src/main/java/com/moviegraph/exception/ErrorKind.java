package com.moviegraph.exception;

/**
 * Failure categories a caller of the recommendation API can act on.
 */
public enum ErrorKind {
    /** Bad input; never worth retrying. */
    INVALID_ARGUMENT,
    /** Connectivity or authentication problem with the graph store. */
    STORE_UNAVAILABLE,
    /** The graph store did not answer within the caller's deadline. */
    TIMEOUT
}
