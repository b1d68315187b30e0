package com.loantracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loantracker.store.DocumentStore;
import com.loantracker.store.memory.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the HTTP surface running against the in-memory store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LoanTrackerApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DocumentStore documentStore;

    @BeforeEach
    void setUp() {
        ((InMemoryDocumentStore) documentStore).reset();
    }

    @Test
    void testRootReportsReady() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Loan Tracker Backend Ready"));
    }

    @Test
    void testCreateCustomerThenList() throws Exception {
        String id = postForId("/api/customers",
            "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\",\"email\":\"ada@example.com\",\"postal_code\":\"SW1Y\"}");

        mockMvc.perform(get("/api/customers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].id").value(id))
            .andExpect(jsonPath("$[0].first_name").value("Ada"))
            .andExpect(jsonPath("$[0].last_name").value("Lovelace"))
            .andExpect(jsonPath("$[0].email").value("ada@example.com"))
            .andExpect(jsonPath("$[0].postal_code").value("SW1Y"));
    }

    @Test
    void testCustomerMissingFirstName_Rejected() throws Exception {
        mockMvc.perform(post("/api/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"last_name\":\"Lovelace\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.first_name").exists());
    }

    @Test
    void testPartnerDefaultsCommissionRate() throws Exception {
        postForId("/api/partners", "{\"name\":\"Acme Referrals\"}");

        mockMvc.perform(get("/api/partners"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Acme Referrals"))
            .andExpect(jsonPath("$[0].commission_rate").value(5.0));
    }

    @Test
    void testPartnerRateAboveHundred_RejectedAndNotStored() throws Exception {
        mockMvc.perform(post("/api/partners")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Greedy\",\"commission_rate\":150}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.commission_rate").value("Commission rate must be between 0 and 100"));

        mockMvc.perform(get("/api/partners"))
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testFundedLoanGetsCommission() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");
        String partnerId = postForId("/api/partners", "{\"name\":\"Acme\",\"commission_rate\":5.0}");

        String loanId = postForId("/api/loans", "{\"customer_id\":\"" + customerId + "\",\"partner_id\":\""
            + partnerId + "\",\"amount\":1000,\"status\":\"funded\"}");

        mockMvc.perform(get("/api/loans"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].id").value(loanId))
            .andExpect(jsonPath("$[0].customer_id").value(customerId))
            .andExpect(jsonPath("$[0].partner_id").value(partnerId))
            .andExpect(jsonPath("$[0].status").value("funded"))
            .andExpect(jsonPath("$[0].commission_amount").value(50.0))
            .andExpect(jsonPath("$[0].funded_date").exists());
    }

    @Test
    void testAppliedLoanPassesValuesThrough() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");

        postForId("/api/loans", "{\"customer_id\":\"" + customerId
            + "\",\"amount\":2500.50,\"application_date\":\"2024-02-01\"}");

        mockMvc.perform(get("/api/loans"))
            .andExpect(jsonPath("$[0].status").value("applied"))
            .andExpect(jsonPath("$[0].application_date").value("2024-02-01"))
            .andExpect(jsonPath("$[0].commission_amount").doesNotExist())
            .andExpect(jsonPath("$[0].funded_date").doesNotExist());
    }

    @Test
    void testLoanForUnknownCustomer_Rejected() throws Exception {
        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"65f0c0ffee0000000000beef\",\"amount\":1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field").value("customer_id"))
            .andExpect(jsonPath("$.reason").value("NOT_FOUND"));
    }

    @Test
    void testLoanWithMalformedCustomerId_Rejected() throws Exception {
        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"not-an-id\",\"amount\":1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field").value("customer_id"))
            .andExpect(jsonPath("$.reason").value("MALFORMED"));
    }

    @Test
    void testLoanWithUpperCaseCustomerId_StoredInCanonicalForm() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");

        postForId("/api/loans", "{\"customer_id\":\"" + customerId.toUpperCase() + "\",\"amount\":1000}");

        mockMvc.perform(get("/api/loans"))
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].customer_id").value(customerId));
    }

    @Test
    void testLoanWithUnknownStatus_Rejected() throws Exception {
        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"65f0c0ffee0000000000beef\",\"amount\":10,\"status\":\"pending\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("Status must be one of applied, approved, funded, rejected, closed"));
    }

    @Test
    void testFundedLoan_PartnerWithCorruptRate_IsServerError() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");
        String partnerId = documentStore.create("partner", Map.of("name", "Legacy", "commission_rate", "abc"));

        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"" + customerId + "\",\"partner_id\":\"" + partnerId
                    + "\",\"amount\":1000,\"status\":\"funded\"}"))
            .andExpect(status().isInternalServerError());

        mockMvc.perform(get("/api/loans"))
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testLoanWithZeroAmount_Rejected() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");

        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"" + customerId + "\",\"amount\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").value("Amount must be positive"));

        mockMvc.perform(get("/api/loans"))
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testLoanWithNonNumericAmount_RejectedNamingField() throws Exception {
        mockMvc.perform(post("/api/loans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"65f0c0ffee0000000000beef\",\"amount\":\"abc\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").value("amount has an invalid value"));
    }

    @Test
    void testListLoansByStatus() throws Exception {
        String customerId = postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");
        postForId("/api/loans", "{\"customer_id\":\"" + customerId + "\",\"amount\":100,\"status\":\"funded\"}");
        postForId("/api/loans", "{\"customer_id\":\"" + customerId + "\",\"amount\":200,\"status\":\"applied\"}");
        postForId("/api/loans", "{\"customer_id\":\"" + customerId + "\",\"amount\":300,\"status\":\"funded\"}");

        mockMvc.perform(get("/api/loans").param("status", "funded"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].status").value("funded"))
            .andExpect(jsonPath("$[1].status").value("funded"));

        mockMvc.perform(get("/api/loans"))
            .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    void testListLoansByUnknownStatus_Rejected() throws Exception {
        mockMvc.perform(get("/api/loans").param("status", "bogus"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").exists());
    }

    @Test
    void testDiagnosticsReport() throws Exception {
        postForId("/api/customers", "{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}");

        mockMvc.perform(get("/test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.backend").value("Running"))
            .andExpect(jsonPath("$.database").value("Connected & Working"))
            .andExpect(jsonPath("$.store_adapter").value("InMemory"))
            .andExpect(jsonPath("$.connection_status").value("Connected"))
            .andExpect(jsonPath("$.collections[0]").value("customer"))
            .andExpect(jsonPath("$.database_url").exists())
            .andExpect(jsonPath("$.database_name").exists());
    }

    private String postForId(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").exists())
            .andReturn();
        JsonNode node = objectMapper.readTree(result.getResponse().getContentAsString());
        return node.get("id").asText();
    }
}
