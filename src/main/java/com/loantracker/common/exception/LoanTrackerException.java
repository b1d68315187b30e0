package com.loantracker.common.exception;

/**
 * Base exception for all loan tracker exceptions.
 */
public class LoanTrackerException extends RuntimeException {

    public LoanTrackerException(String message) {
        super(message);
    }

    public LoanTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
