package com.example.healthintake.session;

/**
 * The session store could not be read or written.
 */
public class SessionUnavailableException extends RuntimeException {

    public SessionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
