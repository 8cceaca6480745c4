package com.loopPhones.exception;

/**
 * Input that has no safe fallback, e.g. a purchase date after the moment being evaluated.
 * Out-of-range values that can be clamped never raise this.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
