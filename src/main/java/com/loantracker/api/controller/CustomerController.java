package com.loantracker.api.controller;

import com.loantracker.api.dto.CreateCustomerRequest;
import com.loantracker.api.dto.CreatedResponse;
import com.loantracker.customers.Customer;
import com.loantracker.customers.CustomerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for customers.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Customer records")
public class CustomerController {

    private final CustomerService customerService;

    @PostMapping
    @Operation(summary = "Create a customer")
    public ResponseEntity<CreatedResponse> createCustomer(@Valid @RequestBody CreateCustomerRequest request) {
        String customerId = customerService.createCustomer(request);
        return ResponseEntity.ok(new CreatedResponse(customerId));
    }

    @GetMapping
    @Operation(summary = "List all customers")
    public ResponseEntity<List<Customer>> listCustomers() {
        return ResponseEntity.ok(customerService.listCustomers());
    }
}
