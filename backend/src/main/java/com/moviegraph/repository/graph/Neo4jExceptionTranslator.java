package com.moviegraph.repository.graph;

import com.moviegraph.exception.ErrorKind;
import com.moviegraph.exception.RecommendationException;
import com.moviegraph.exception.StoreTimeoutException;
import com.moviegraph.exception.StoreUnavailableException;
import org.neo4j.driver.exceptions.ConnectionReadTimeoutException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.SecurityException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.dao.QueryTimeoutException;

import java.util.Locale;

/**
 * Maps Neo4j driver failures onto the store error kinds exposed to callers.
 */
public final class Neo4jExceptionTranslator {

    private static final String TRANSACTION_TIMED_OUT = "TransactionTimedOut";
    private static final String POOL_ACQUISITION_FAILURE = "unable to acquire connection";

    private Neo4jExceptionTranslator() {
    }

    static RecommendationException translate(Neo4jException ex, String operation) {
        if (isTimeout(ex)) {
            return new StoreTimeoutException(operation + " timed out: " + ex.getMessage(), ex);
        }
        if (ex instanceof ServiceUnavailableException
                || ex instanceof SessionExpiredException
                || ex instanceof SecurityException) {
            return new StoreUnavailableException(operation + " failed, graph store unavailable: " + ex.getMessage(), ex);
        }
        return new StoreUnavailableException(operation + " failed: " + ex.getMessage(), ex);
    }

    /**
     * Classifies a store failure that reached the caller wrapped by Spring
     * (repository exception translation or the transaction manager). Any
     * timeout in the cause chain wins; everything else is an unavailable store.
     */
    public static ErrorKind classify(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof QueryTimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            if (current instanceof Neo4jException && isTimeout((Neo4jException) current)) {
                return ErrorKind.TIMEOUT;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return ErrorKind.STORE_UNAVAILABLE;
    }

    private static boolean isTimeout(Neo4jException ex) {
        if (ex instanceof ConnectionReadTimeoutException) {
            return true;
        }
        String code = ex.code();
        if (code != null && code.contains(TRANSACTION_TIMED_OUT)) {
            return true;
        }
        String message = ex.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(POOL_ACQUISITION_FAILURE);
    }
}
