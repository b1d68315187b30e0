package com.loantracker.partners;

import com.loantracker.store.DocumentStore;
import com.loantracker.store.DocumentValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Referral partner: the source a loan came from, paid a commission once it funds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Partner {

    public static final String COLLECTION = "partner";
    public static final String COMMISSION_RATE_FIELD = "commission_rate";
    public static final BigDecimal DEFAULT_COMMISSION_RATE = new BigDecimal("5.0");

    private String id;

    private String name;

    private String contactName;

    private String email;

    private String phone;

    /**
     * Commission percentage in [0, 100].
     */
    private BigDecimal commissionRate;

    private String notes;

    private Instant createdAt;

    private Instant updatedAt;

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", name);
        document.put("contact_name", contactName);
        document.put("email", email);
        document.put("phone", phone);
        document.put(COMMISSION_RATE_FIELD, commissionRate);
        document.put("notes", notes);
        return document;
    }

    public static Partner fromDocument(Map<String, Object> document) {
        return Partner.builder()
            .id(DocumentValues.getString(document, DocumentStore.ID_FIELD))
            .name(DocumentValues.getString(document, "name"))
            .contactName(DocumentValues.getString(document, "contact_name"))
            .email(DocumentValues.getString(document, "email"))
            .phone(DocumentValues.getString(document, "phone"))
            .commissionRate(DocumentValues.getDecimal(document, COMMISSION_RATE_FIELD))
            .notes(DocumentValues.getString(document, "notes"))
            .createdAt(DocumentValues.getInstant(document, DocumentStore.CREATED_AT_FIELD))
            .updatedAt(DocumentValues.getInstant(document, DocumentStore.UPDATED_AT_FIELD))
            .build();
    }
}
