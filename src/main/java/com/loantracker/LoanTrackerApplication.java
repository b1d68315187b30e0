package com.loantracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Loan Tracker.
 *
 * Loan Tracker records customers, referral partners and the loans they bring in,
 * and derives the partner commission when a loan is booked as funded.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LoanTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanTrackerApplication.class, args);
    }
}
