package com.moviebot.recommendation;

public class ExternalCallException extends RuntimeException {
    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
