package com.example.seer.exception;

/**
 * An entity failed one of its invariants at construction or before persistence.
 */
public class ConsistencyViolationException extends RuntimeException {
    public ConsistencyViolationException(String message) {
        super(message);
    }
}
