package com.loantracker.api.controller;

import com.loantracker.api.dto.CreatePartnerRequest;
import com.loantracker.api.dto.CreatedResponse;
import com.loantracker.partners.Partner;
import com.loantracker.partners.PartnerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for referral partners.
 */
@RestController
@RequestMapping("/api/partners")
@RequiredArgsConstructor
@Tag(name = "Partners", description = "Referral partner records")
public class PartnerController {

    private final PartnerService partnerService;

    @PostMapping
    @Operation(summary = "Create a referral partner")
    public ResponseEntity<CreatedResponse> createPartner(@Valid @RequestBody CreatePartnerRequest request) {
        String partnerId = partnerService.createPartner(request);
        return ResponseEntity.ok(new CreatedResponse(partnerId));
    }

    @GetMapping
    @Operation(summary = "List all referral partners")
    public ResponseEntity<List<Partner>> listPartners() {
        return ResponseEntity.ok(partnerService.listPartners());
    }
}
