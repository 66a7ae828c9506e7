package com.moviegraph.exception;

public class StoreTimeoutException extends RecommendationException {

    public StoreTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
