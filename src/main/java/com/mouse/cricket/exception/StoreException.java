package com.mouse.cricket.exception;

public class StoreException extends RuntimeException{
    public StoreException() {
        super();
    }

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable e) {
        super(message, e);
    }
}
