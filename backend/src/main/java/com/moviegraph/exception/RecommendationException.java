package com.moviegraph.exception;

import lombok.Getter;

@Getter
public abstract class RecommendationException extends RuntimeException {

    private final ErrorKind kind;

    protected RecommendationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RecommendationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
