package com.loopPhones.exception;

/** Persistence, ledger or engine failure the caller cannot recover from. */
public class ServiceException extends RuntimeException {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
