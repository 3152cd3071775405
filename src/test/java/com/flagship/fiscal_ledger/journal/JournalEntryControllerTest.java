package com.flagship.fiscal_ledger.journal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fiscal_ledger.account.Account;
import com.flagship.fiscal_ledger.account.AccountService;
import com.flagship.fiscal_ledger.account.AccountType;
import com.flagship.fiscal_ledger.period.FiscalPeriod;
import com.flagship.fiscal_ledger.period.FiscalPeriodService;
import com.flagship.fiscal_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Journal entries and the account ledger over HTTP.
 */
class JournalEntryControllerTest extends PostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FiscalPeriodService periodService;

    @Autowired
    private AccountService accountService;

    private UUID tenantId;
    private UUID actor;
    private FiscalPeriod period;
    private Account cash;
    private Account sales;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        actor = UUID.randomUUID();
        period = periodService.createFromName(tenantId, "2082/83");
        cash = accountService.create(tenantId, "1000", "Cash", AccountType.ASSET, null, null);
        sales = accountService.create(tenantId, "4000", "Sales", AccountType.REVENUE, null, null);
    }

    private String entryJson(String debit, String credit, boolean voucher) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "fiscal_period_id", period.getId(),
            "transaction_date", "2025-08-01",
            "description", "Counter sale",
            "assign_voucher_number", voucher,
            "lines", List.of(
                Map.of("account_id", cash.getId(), "debit", debit),
                Map.of("account_id", sales.getId(), "credit", credit)
            )
        ));
    }

    @Test
    @DisplayName("Draft, post, then the second post is 409 CONFLICT")
    void createAndPost() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/tenants/{tenantId}/journal-entries", tenantId)
                .header(ACTOR_HEADER, actor.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("500", "500", true)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.voucher_number").value("JV-8283-0001"))
            .andExpect(jsonPath("$.total_debit").value(500.0))
            .andExpect(jsonPath("$.lines.length()").value(2))
            .andExpect(jsonPath("$.lines[0].line_number").value(1))
            .andReturn();
        JsonNode body = objectMapper.readTree(created.getResponse().getContentAsString());
        UUID entryId = UUID.fromString(body.get("id").asText());

        mockMvc.perform(post("/api/journal-entries/{entryId}/post", entryId)
                .header(ACTOR_HEADER, actor.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("POSTED"))
            .andExpect(jsonPath("$.posted_by").value(actor.toString()));

        mockMvc.perform(post("/api/journal-entries/{entryId}/post", entryId)
                .header(ACTOR_HEADER, actor.toString()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("CONFLICT"));

        mockMvc.perform(get("/api/tenants/{tenantId}/accounts/{accountId}/ledger", tenantId, cash.getId())
                .param("from", "2025-07-16")
                .param("to", "2026-07-15"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].journal_entry_id").value(entryId.toString()))
            .andExpect(jsonPath("$[0].running_balance").value(500.0));

        mockMvc.perform(get("/api/tenants/{tenantId}/accounts/{accountId}/ledger/summary", tenantId, sales.getId())
                .param("from", "2025-07-16")
                .param("to", "2026-07-15"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.closing_balance").value(-500.0))
            .andExpect(jsonPath("$.natural_balance").value(500.0));
    }

    @Test
    @DisplayName("Unbalanced entry is 400 VALIDATION")
    void unbalanced() throws Exception {
        mockMvc.perform(post("/api/tenants/{tenantId}/journal-entries", tenantId)
                .header(ACTOR_HEADER, actor.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("500", "400", false)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"));

        mockMvc.perform(get("/api/tenants/{tenantId}/periods/{periodId}/journal-entries", tenantId, period.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Negative amounts fail request validation")
    void negativeAmount() throws Exception {
        mockMvc.perform(post("/api/tenants/{tenantId}/journal-entries", tenantId)
                .header(ACTOR_HEADER, actor.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("-500", "-500", false)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    @DisplayName("Unknown entry is 404; ledger with reversed range is 400")
    void notFoundAndBadRange() throws Exception {
        mockMvc.perform(get("/api/journal-entries/{entryId}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mockMvc.perform(get("/api/tenants/{tenantId}/accounts/{accountId}/ledger", tenantId, cash.getId())
                .param("from", "2026-01-01")
                .param("to", "2025-01-01"))
            .andExpect(status().isBadRequest());
    }
}
