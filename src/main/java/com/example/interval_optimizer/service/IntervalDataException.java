package com.example.interval_optimizer.service;

/**
 * Raised when interval records cannot be converted into integer triples.
 */
public class IntervalDataException extends RuntimeException {

    public IntervalDataException(String message) {
        super(message);
    }

    public IntervalDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
