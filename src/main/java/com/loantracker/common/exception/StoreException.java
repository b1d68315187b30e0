package com.loantracker.common.exception;

/**
 * Thrown when the document store is unreachable, an operation against it fails,
 * or a stored value cannot be read back.
 *
 * This wraps all errors from the underlying database driver,
 * allowing callers to handle them consistently.
 */
public class StoreException extends LoanTrackerException {

    private final String collection;
    private final String operation;

    public StoreException(String message, String collection, String operation, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.operation = operation;
    }

    public String getCollection() {
        return collection;
    }

    public String getOperation() {
        return operation;
    }
}
