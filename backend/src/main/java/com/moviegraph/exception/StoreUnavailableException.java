package com.moviegraph.exception;

public class StoreUnavailableException extends RecommendationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
