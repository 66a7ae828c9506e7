package com.moviegraph.exception;

public class InvalidArgumentException extends RecommendationException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
