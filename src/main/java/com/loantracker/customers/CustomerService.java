package com.loantracker.customers;

import com.loantracker.api.dto.CreateCustomerRequest;
import com.loantracker.store.DocumentStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for creating and listing customers.
 */
@Service
@RequiredArgsConstructor
@Validated
@Slf4j
public class CustomerService {

    private final DocumentStore documentStore;

    public String createCustomer(@Valid CreateCustomerRequest request) {
        Customer customer = Customer.builder()
            .firstName(request.getFirstName())
            .lastName(request.getLastName())
            .email(request.getEmail())
            .phone(request.getPhone())
            .address(request.getAddress())
            .city(request.getCity())
            .state(request.getState())
            .postalCode(request.getPostalCode())
            .notes(request.getNotes())
            .build();

        String customerId = documentStore.create(Customer.COLLECTION, customer.toDocument());
        log.info("Created customer {} ({} {})", customerId, customer.getFirstName(), customer.getLastName());
        return customerId;
    }

    public List<Customer> listCustomers() {
        return documentStore.list(Customer.COLLECTION).stream()
            .map(Customer::fromDocument)
            .collect(Collectors.toList());
    }
}
