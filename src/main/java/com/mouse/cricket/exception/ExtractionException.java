package com.mouse.cricket.exception;

public class ExtractionException extends RuntimeException{
    public ExtractionException() {
        super();
    }

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable e) {
        super(message, e);
    }
}
