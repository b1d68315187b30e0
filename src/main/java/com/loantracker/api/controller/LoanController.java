package com.loantracker.api.controller;

import com.loantracker.api.dto.CreateLoanRequest;
import com.loantracker.api.dto.CreatedResponse;
import com.loantracker.loans.Loan;
import com.loantracker.loans.LoanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for loans.
 */
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Loans", description = "Loan admission and listing")
public class LoanController {

    private final LoanService loanService;

    /**
     * Create a loan.
     *
     * customer_id and partner_id must reference existing records. A loan created
     * as funded gets its commission and funded date derived here.
     */
    @PostMapping
    @Operation(summary = "Create a loan, checking references and deriving commission")
    public ResponseEntity<CreatedResponse> createLoan(@Valid @RequestBody CreateLoanRequest request) {
        log.debug("Received loan request for customer {}", request.getCustomerId());
        String loanId = loanService.admitLoan(request);
        return ResponseEntity.ok(new CreatedResponse(loanId));
    }

    @GetMapping
    @Operation(summary = "List loans, optionally filtered by status")
    public ResponseEntity<List<Loan>> listLoans(@RequestParam(required = false) String status) {
        return ResponseEntity.ok(loanService.listLoans(status));
    }
}
