package com.loantracker.api.controller;

import com.loantracker.diagnostics.DiagnosticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and store diagnostics.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Diagnostics", description = "Liveness and store reachability")
public class DiagnosticsController {

    private final DiagnosticsService diagnosticsService;

    @GetMapping("/")
    @Operation(summary = "Liveness message")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Loan Tracker Backend Ready"));
    }

    @GetMapping("/test")
    @Operation(summary = "Report store reachability, collections and configuration")
    public ResponseEntity<Map<String, Object>> testDatabase() {
        return ResponseEntity.ok(diagnosticsService.report());
    }
}
