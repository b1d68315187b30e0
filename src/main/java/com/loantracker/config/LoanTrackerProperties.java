package com.loantracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code loan-tracker.*} properties, validated at startup.
 */
@ConfigurationProperties(prefix = "loan-tracker")
@Validated
@Data
public class LoanTrackerProperties {

    @Valid
    @NotNull
    private Store store = new Store();

    @Valid
    @NotNull
    private Cors cors = new Cors();

    /**
     * {@code loan-tracker.store.type} ({@code mongo} or {@code memory}) is read by the
     * conditions in {@link LoanTrackerConfig}.
     */
    @Data
    public static class Store {

        /**
         * Database name reported by the in-memory store. MongoDB takes its name
         * from {@code spring.data.mongodb.database}.
         */
        @NotBlank
        private String database = "loan_tracker";
    }

    @Data
    public static class Cors {

        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
