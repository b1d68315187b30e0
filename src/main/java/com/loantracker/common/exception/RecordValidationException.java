package com.loantracker.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a request value fails a check made by a service, such as an
 * unknown loan status filter.
 */
public class RecordValidationException extends LoanTrackerException {

    private final Map<String, String> fieldErrors;

    public RecordValidationException(String recordType, Map<String, String> fieldErrors) {
        super(String.format("Invalid %s: %s", recordType, fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public static RecordValidationException forField(String recordType, String field, String message) {
        return new RecordValidationException(recordType, Map.of(field, message));
    }

    /**
     * Offending fields in the order they were checked, mapped to their messages.
     */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
