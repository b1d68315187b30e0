package com.loantracker.common.exception;

/**
 * Thrown when a loan references a customer or partner that cannot be resolved.
 *
 * The two failure modes share an HTTP status but keep distinct messages and
 * {@link Reason} values so callers can tell a typo from a missing record.
 */
public class InvalidReferenceException extends LoanTrackerException {

    public enum Reason {
        /** The value is not a well-formed record id. */
        MALFORMED,
        /** The value is well formed but no record carries it. */
        NOT_FOUND
    }

    private final String field;
    private final Reason reason;

    public InvalidReferenceException(String field, String value, Reason reason, Throwable cause) {
        super(buildMessage(field, value, reason), cause);
        this.field = field;
        this.reason = reason;
    }

    public static InvalidReferenceException malformed(String field, String value, Throwable cause) {
        return new InvalidReferenceException(field, value, Reason.MALFORMED, cause);
    }

    public static InvalidReferenceException notFound(String field, String value) {
        return new InvalidReferenceException(field, value, Reason.NOT_FOUND, null);
    }

    public String getField() {
        return field;
    }

    public Reason getReason() {
        return reason;
    }

    private static String buildMessage(String field, String value, Reason reason) {
        return switch (reason) {
            case MALFORMED -> String.format("Invalid %s format: '%s' is not a valid identifier", field, value);
            case NOT_FOUND -> String.format("Invalid %s: no record found with id %s", field, value);
        };
    }
}
