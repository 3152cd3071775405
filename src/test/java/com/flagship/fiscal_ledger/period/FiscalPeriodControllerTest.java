package com.flagship.fiscal_ledger.period;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fiscal_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of fiscal periods: status codes and error kinds.
 */
class FiscalPeriodControllerTest extends PostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private UUID createFromName(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/tenants/{tenantId}/periods/from-name", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"" + name + "\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    @Test
    @DisplayName("Create from name returns both calendars and the prefixes")
    void createFromName() throws Exception {
        printTestHeader("Create period from name");

        mockMvc.perform(post("/api/tenants/{tenantId}/periods/from-name", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"2082/83\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("2082/83"))
            .andExpect(jsonPath("$.start_date").value("2025-07-16"))
            .andExpect(jsonPath("$.end_date").value("2026-07-15"))
            .andExpect(jsonPath("$.start_date_secondary").value("2082-04-01"))
            .andExpect(jsonPath("$.end_date_secondary").value("2083-03-32"))
            .andExpect(jsonPath("$.invoice_prefix").value("INV-8283-"))
            .andExpect(jsonPath("$.is_current").value(false))
            .andExpect(jsonPath("$.is_closed").value(false));
    }

    @Test
    @DisplayName("Malformed name is rejected with 400")
    void malformedName() throws Exception {
        mockMvc.perform(post("/api/tenants/{tenantId}/periods/from-name", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"2082-83\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    @DisplayName("Duplicate name is 409 CONFLICT")
    void duplicateName() throws Exception {
        createFromName("2082/83");

        mockMvc.perform(post("/api/tenants/{tenantId}/periods/from-name", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"2082/83\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("CONFLICT"));
    }

    @Test
    @DisplayName("Create with explicit dates derives the secondary calendar")
    void createWithDates() throws Exception {
        mockMvc.perform(post("/api/tenants/{tenantId}/periods", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"2081/82\",\"start_date\":\"2024-07-16\",\"end_date\":\"2025-07-15\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.start_date_secondary").value("2081-04-01"))
            .andExpect(jsonPath("$.voucher_prefix").value("JV-8182-"));
    }

    @Test
    @DisplayName("Numbers by document type; closed period answers 409 STATE")
    void numbering() throws Exception {
        printTestHeader("Document numbering over HTTP");
        UUID periodId = createFromName("2082/83");

        mockMvc.perform(post("/api/periods/{periodId}/numbers/{type}", periodId, "invoice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.document_type").value("INVOICE"))
            .andExpect(jsonPath("$.number").value("INV-8283-0001"));
        mockMvc.perform(post("/api/periods/{periodId}/numbers/{type}", periodId, "PUR"))
            .andExpect(jsonPath("$.number").value("PUR-8283-0001"));
        mockMvc.perform(post("/api/periods/{periodId}/numbers/{type}", periodId, "receipt"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/periods/{periodId}/close", periodId)
                .header(ACTOR_HEADER, UUID.randomUUID().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_closed").value(true))
            .andExpect(jsonPath("$.last_invoice_num").value(1));

        mockMvc.perform(post("/api/periods/{periodId}/numbers/{type}", periodId, "invoice"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("STATE"));

        mockMvc.perform(post("/api/periods/{periodId}/reopen", periodId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_closed").value(false));
        mockMvc.perform(post("/api/periods/{periodId}/numbers/{type}", periodId, "invoice"))
            .andExpect(jsonPath("$.number").value("INV-8283-0002"));
    }

    @Test
    @DisplayName("Close requires the actor header")
    void closeWithoutActor() throws Exception {
        UUID periodId = createFromName("2082/83");

        mockMvc.perform(post("/api/periods/{periodId}/close", periodId))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    @DisplayName("Current period: 404 before selection, then the selected one")
    void currentPeriod() throws Exception {
        UUID periodId = createFromName("2082/83");

        mockMvc.perform(get("/api/tenants/{tenantId}/periods/current", tenantId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mockMvc.perform(put("/api/tenants/{tenantId}/periods/{periodId}/current", tenantId, periodId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_current").value(true));

        mockMvc.perform(get("/api/tenants/{tenantId}/periods/current", tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(periodId.toString()));

        mockMvc.perform(delete("/api/periods/{periodId}", periodId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("STATE"));
    }

    @Test
    @DisplayName("Delete an open period answers 204, then 404")
    void deletePeriod() throws Exception {
        UUID periodId = createFromName("2082/83");

        mockMvc.perform(delete("/api/periods/{periodId}", periodId))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/periods/{periodId}", periodId))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/tenants/{tenantId}/periods", tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }
}
