package com.example.healthintake.dispatch;

/**
 * The LLM call failed, timed out, or returned output that could not be parsed.
 */
public class ExtractionFailedException extends RuntimeException {

    public ExtractionFailedException(String message) {
        super(message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
