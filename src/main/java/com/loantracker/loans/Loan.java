package com.loantracker.loans;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.loantracker.store.DocumentStore;
import com.loantracker.store.DocumentValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loan record.
 *
 * A loan always belongs to one customer and may credit one referral partner.
 * References hold the canonical string form of the target record's id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loan {

    public static final String COLLECTION = "loan";
    public static final String STATUS_FIELD = "status";

    private String id;

    private String customerId;

    private String partnerId;

    private BigDecimal amount;

    private LoanStatus status;

    private LocalDate applicationDate;

    /**
     * Filled with the admission date when a loan is created funded without one.
     */
    private LocalDate fundedDate;

    /**
     * Derived from the partner's rate when a loan is created funded.
     */
    private BigDecimal commissionAmount;

    private Instant createdAt;

    private Instant updatedAt;

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("customer_id", customerId);
        document.put("partner_id", partnerId);
        document.put("amount", amount);
        document.put(STATUS_FIELD, status == null ? null : status.getWireName());
        document.put("application_date", DocumentValues.formatDate(applicationDate));
        document.put("funded_date", DocumentValues.formatDate(fundedDate));
        document.put("commission_amount", commissionAmount);
        return document;
    }

    public static Loan fromDocument(Map<String, Object> document) {
        String status = DocumentValues.getString(document, STATUS_FIELD);
        return Loan.builder()
            .id(DocumentValues.getString(document, DocumentStore.ID_FIELD))
            .customerId(DocumentValues.getString(document, "customer_id"))
            .partnerId(DocumentValues.getString(document, "partner_id"))
            .amount(DocumentValues.getDecimal(document, "amount"))
            .status(status == null ? null : LoanStatus.fromWireName(status)
                .orElseThrow(() -> new IllegalStateException("Unknown stored loan status: " + status)))
            .applicationDate(DocumentValues.getDate(document, "application_date"))
            .fundedDate(DocumentValues.getDate(document, "funded_date"))
            .commissionAmount(DocumentValues.getDecimal(document, "commission_amount"))
            .createdAt(DocumentValues.getInstant(document, DocumentStore.CREATED_AT_FIELD))
            .updatedAt(DocumentValues.getInstant(document, DocumentStore.UPDATED_AT_FIELD))
            .build();
    }

    @JsonIgnore
    public boolean isFunded() {
        return status == LoanStatus.FUNDED;
    }
}
