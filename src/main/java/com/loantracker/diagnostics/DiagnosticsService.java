package com.loantracker.diagnostics;

import com.loantracker.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort report on store reachability and configuration.
 *
 * Never throws: every failure is reported as part of the returned data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsService {

    static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;
    static final String DATABASE_URL_VARIABLE = "DATABASE_URL";
    static final String DATABASE_NAME_VARIABLE = "DATABASE_NAME";

    private final DocumentStore documentStore;
    private final Environment environment;

    public Map<String, Object> report() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("backend", "Running");
        report.put("database", "Not Available");
        report.put("store_adapter", documentStore.getAdapterName());
        report.put("connection_status", "Not Connected");
        report.put("collections", List.of());

        try {
            report.put("database", "Available");
            report.put("database_instance", documentStore.databaseName());
            report.put("connection_status", "Connected");
            try {
                List<String> collections = new ArrayList<>(documentStore.collectionNames());
                report.put("collections", collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())));
                report.put("database", "Connected & Working");
            } catch (Exception e) {
                log.warn("Diagnostics: store reachable but listing collections failed", e);
                report.put("database", "Connected but Error: " + truncate(e.getMessage()));
            }
        } catch (Exception e) {
            log.warn("Diagnostics: store unavailable", e);
            report.put("database", "Error: " + truncate(e.getMessage()));
            report.put("connection_status", "Not Connected");
        }

        report.put("database_url", isSet(DATABASE_URL_VARIABLE) ? "Set" : "Not Set");
        report.put("database_name", isSet(DATABASE_NAME_VARIABLE) ? "Set" : "Not Set");
        return report;
    }

    private boolean isSet(String variable) {
        String value = environment.getProperty(variable);
        return value != null && !value.isBlank();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
