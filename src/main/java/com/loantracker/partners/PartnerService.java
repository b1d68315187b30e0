package com.loantracker.partners;

import com.loantracker.api.dto.CreatePartnerRequest;
import com.loantracker.store.DocumentStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for creating and listing referral partners.
 */
@Service
@RequiredArgsConstructor
@Validated
@Slf4j
public class PartnerService {

    private final DocumentStore documentStore;

    public String createPartner(@Valid CreatePartnerRequest request) {
        Partner partner = Partner.builder()
            .name(request.getName())
            .contactName(request.getContactName())
            .email(request.getEmail())
            .phone(request.getPhone())
            .commissionRate(request.getCommissionRate() != null
                ? request.getCommissionRate()
                : Partner.DEFAULT_COMMISSION_RATE)
            .notes(request.getNotes())
            .build();

        String partnerId = documentStore.create(Partner.COLLECTION, partner.toDocument());
        log.info("Created partner {} ({}) with commission rate {}%",
            partnerId, partner.getName(), partner.getCommissionRate());
        return partnerId;
    }

    public List<Partner> listPartners() {
        return documentStore.list(Partner.COLLECTION).stream()
            .map(Partner::fromDocument)
            .collect(Collectors.toList());
    }
}
