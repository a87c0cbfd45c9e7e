package com.mouse.cricket.exception;

public class SchedulerInitializationException extends RuntimeException {

    public SchedulerInitializationException(String message, Throwable e) {
        super(message, e);
    }
}
