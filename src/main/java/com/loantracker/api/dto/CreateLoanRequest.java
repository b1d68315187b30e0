package com.loantracker.api.dto;

import com.loantracker.loans.LoanStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for creating a loan.
 *
 * Status is kept as raw text so an unknown value is reported with the other
 * field errors instead of failing JSON binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLoanRequest {

    @NotBlank(message = "Customer ID is required")
    private String customerId;

    private String partnerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    @Pattern(regexp = LoanStatus.WIRE_NAME_PATTERN,
        message = "Status must be one of applied, approved, funded, rejected, closed")
    private String status;

    private LocalDate applicationDate;

    private LocalDate fundedDate;

    @PositiveOrZero(message = "Commission amount cannot be negative")
    private BigDecimal commissionAmount;
}
