package com.loantracker.loans;

import com.loantracker.api.dto.CreateLoanRequest;
import com.loantracker.common.RecordId;
import com.loantracker.common.exception.InvalidReferenceException;
import com.loantracker.common.exception.MalformedRecordIdException;
import com.loantracker.common.exception.RecordValidationException;
import com.loantracker.customers.Customer;
import com.loantracker.partners.Partner;
import com.loantracker.store.DocumentStore;
import com.loantracker.store.DocumentValues;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Loan admission: the only place with business rules.
 *
 * ADMISSION FLOW:
 * 1. Validate the payload (no store access before this)
 * 2. Resolve customer_id against the customer collection
 * 3. Resolve partner_id against the partner collection, if present
 * 4. If the loan is funded, derive commission from the partner's rate and
 *    default funded_date to today (UTC)
 * 5. Persist the loan, with references in canonical id form
 *
 * Commission is derived at creation only; there is no update path.
 * References are read and the loan written as independent documents, without
 * a multi-document transaction.
 */
@Service
@RequiredArgsConstructor
@Validated
@Slf4j
public class LoanService {

    static final String CUSTOMER_REFERENCE = "customer_id";
    static final String PARTNER_REFERENCE = "partner_id";
    static final String RECORD_TYPE = "loan";

    private final DocumentStore documentStore;
    private final CommissionCalculator commissionCalculator;
    private final Clock clock;

    /**
     * Validate, resolve references, derive commission and persist a new loan.
     *
     * @return the new loan's identifier
     * @throws RecordValidationException if status is not a known loan status
     * @throws InvalidReferenceException if customer_id or partner_id is malformed or unknown
     */
    public String admitLoan(@Valid CreateLoanRequest request) {
        LoanStatus status = request.getStatus() == null
            ? LoanStatus.APPLIED
            : parseStatus(request.getStatus());

        RecordId customerId = parseReference(CUSTOMER_REFERENCE, request.getCustomerId());
        requireRecord(Customer.COLLECTION, CUSTOMER_REFERENCE, customerId);

        RecordId partnerId = null;
        Optional<Map<String, Object>> partner = Optional.empty();
        if (hasText(request.getPartnerId())) {
            partnerId = parseReference(PARTNER_REFERENCE, request.getPartnerId());
            partner = Optional.of(requireRecord(Partner.COLLECTION, PARTNER_REFERENCE, partnerId));
        }

        Loan loan = Loan.builder()
            .customerId(customerId.toString())
            .partnerId(partnerId != null ? partnerId.toString() : null)
            .amount(request.getAmount())
            .status(status)
            .applicationDate(request.getApplicationDate())
            .fundedDate(request.getFundedDate())
            .commissionAmount(request.getCommissionAmount())
            .build();

        if (loan.isFunded()) {
            applyFunding(loan, partner);
        }

        String loanId = documentStore.create(Loan.COLLECTION, loan.toDocument());

        log.info("Admitted loan {} for customer {}: amount={}, status={}, partner={}, commission={}",
            loanId, loan.getCustomerId(), loan.getAmount(), status.getWireName(),
            loan.getPartnerId(), loan.getCommissionAmount());

        return loanId;
    }

    /**
     * List loans, optionally only those in one status.
     *
     * @param status wire name of the status to match; null or blank lists all loans
     * @throws RecordValidationException if status is not a known loan status
     */
    public List<Loan> listLoans(String status) {
        Map<String, Object> filter = Map.of();
        if (hasText(status)) {
            filter = Map.of(Loan.STATUS_FIELD, parseStatus(status).getWireName());
        }

        return documentStore.list(Loan.COLLECTION, filter).stream()
            .map(Loan::fromDocument)
            .collect(Collectors.toList());
    }

    private void applyFunding(Loan loan, Optional<Map<String, Object>> partner) {
        BigDecimal rate = partner
            .map(document -> DocumentValues.getDecimal(document, Partner.COMMISSION_RATE_FIELD))
            .orElse(BigDecimal.ZERO);

        loan.setCommissionAmount(commissionCalculator.calculate(loan.getAmount(), rate));

        if (loan.getFundedDate() == null) {
            loan.setFundedDate(LocalDate.now(clock));
        }

        log.debug("Funded loan for customer {}: rate={}%, commission={}, fundedDate={}",
            loan.getCustomerId(), rate, loan.getCommissionAmount(), loan.getFundedDate());
    }

    private static LoanStatus parseStatus(String status) {
        return LoanStatus.fromWireName(status)
            .orElseThrow(() -> RecordValidationException.forField(RECORD_TYPE,
                Loan.STATUS_FIELD, "Status must be one of " + LoanStatus.wireNames()));
    }

    private RecordId parseReference(String field, String value) {
        try {
            return RecordId.parse(value);
        } catch (MalformedRecordIdException e) {
            log.info("Rejected loan: {} '{}' is not a valid identifier", field, value);
            throw InvalidReferenceException.malformed(field, value, e);
        }
    }

    private Map<String, Object> requireRecord(String collection, String field, RecordId id) {
        return documentStore.findById(collection, id.toString())
            .orElseThrow(() -> {
                log.info("Rejected loan: {} {} does not exist", field, id);
                return InvalidReferenceException.notFound(field, id.toString());
            });
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
