package com.loantracker.common.exception;

/**
 * Thrown when text cannot be parsed as a record identifier.
 */
public class MalformedRecordIdException extends LoanTrackerException {

    public MalformedRecordIdException(String rawValue) {
        super("Malformed record id: " + rawValue);
    }
}
