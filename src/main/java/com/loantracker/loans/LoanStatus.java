package com.loantracker.loans;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lifecycle states for a loan.
 */
public enum LoanStatus {
    /**
     * Application received. Default for new loans.
     */
    APPLIED("applied"),

    APPROVED("approved"),

    /**
     * Money disbursed. Creating a loan in this state derives its commission.
     */
    FUNDED("funded"),

    REJECTED("rejected"),

    CLOSED("closed");

    /**
     * Matches exactly the wire names above.
     */
    public static final String WIRE_NAME_PATTERN = "applied|approved|funded|rejected|closed";

    private final String wireName;

    LoanStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lower-case name used in JSON and in stored documents.
     */
    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<LoanStatus> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(status -> status.wireName.equals(wireName))
            .findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values())
            .map(LoanStatus::getWireName)
            .collect(Collectors.toList());
    }
}
