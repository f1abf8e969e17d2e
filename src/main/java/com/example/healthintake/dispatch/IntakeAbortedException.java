package com.example.healthintake.dispatch;

/**
 * The request was cancelled while waiting on an external call. Nothing is written for it.
 */
public class IntakeAbortedException extends RuntimeException {

    public IntakeAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
