package com.loantracker.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for creating a referral partner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePartnerRequest {

    @NotBlank(message = "Partner name is required")
    private String name;

    private String contactName;

    private String email;

    private String phone;

    /**
     * Percentage of a funded loan's amount owed to the partner. Defaults to 5.0 when omitted.
     */
    @DecimalMin(value = "0", message = "Commission rate must be between 0 and 100")
    @DecimalMax(value = "100", message = "Commission rate must be between 0 and 100")
    private BigDecimal commissionRate;

    private String notes;
}
