package com.loantracker.customers;

import com.loantracker.store.DocumentStore;
import com.loantracker.store.DocumentValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Customer record: the borrower side of a loan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    public static final String COLLECTION = "customer";

    private String id;

    private String firstName;

    private String lastName;

    private String email;

    private String phone;

    private String address;

    private String city;

    private String state;

    private String postalCode;

    private String notes;

    private Instant createdAt;

    private Instant updatedAt;

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("first_name", firstName);
        document.put("last_name", lastName);
        document.put("email", email);
        document.put("phone", phone);
        document.put("address", address);
        document.put("city", city);
        document.put("state", state);
        document.put("postal_code", postalCode);
        document.put("notes", notes);
        return document;
    }

    public static Customer fromDocument(Map<String, Object> document) {
        return Customer.builder()
            .id(DocumentValues.getString(document, DocumentStore.ID_FIELD))
            .firstName(DocumentValues.getString(document, "first_name"))
            .lastName(DocumentValues.getString(document, "last_name"))
            .email(DocumentValues.getString(document, "email"))
            .phone(DocumentValues.getString(document, "phone"))
            .address(DocumentValues.getString(document, "address"))
            .city(DocumentValues.getString(document, "city"))
            .state(DocumentValues.getString(document, "state"))
            .postalCode(DocumentValues.getString(document, "postal_code"))
            .notes(DocumentValues.getString(document, "notes"))
            .createdAt(DocumentValues.getInstant(document, DocumentStore.CREATED_AT_FIELD))
            .updatedAt(DocumentValues.getInstant(document, DocumentStore.UPDATED_AT_FIELD))
            .build();
    }
}
