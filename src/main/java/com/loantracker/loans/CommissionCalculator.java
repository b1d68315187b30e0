package com.loantracker.loans;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives the commission owed to a partner on a funded loan.
 *
 * Result is rounded to cents with HALF_UP, the rounding used for every monetary
 * amount in this service.
 */
@Component
public class CommissionCalculator {

    public static final int SCALE = 2;

    /**
     * @param amount loan principal, strictly positive
     * @param ratePercent commission percentage in [0, 100]; null counts as 0
     * @return amount * rate / 100, rounded to 2 decimal places
     */
    public BigDecimal calculate(BigDecimal amount, BigDecimal ratePercent) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        BigDecimal rate = ratePercent == null ? BigDecimal.ZERO : ratePercent;
        return amount.multiply(rate)
            .movePointLeft(2)
            .setScale(SCALE, RoundingMode.HALF_UP);
    }
}
