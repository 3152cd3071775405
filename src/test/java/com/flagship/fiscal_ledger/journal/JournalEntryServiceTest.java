package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.account.AccountService;
import com.flagship.fiscal_ledger.exception.ConflictException;
import com.flagship.fiscal_ledger.exception.NotFoundException;
import com.flagship.fiscal_ledger.exception.StateException;
import com.flagship.fiscal_ledger.exception.ValidationException;
import com.flagship.fiscal_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.fiscal_ledger.observability.LedgerMetrics;
import com.flagship.fiscal_ledger.outbox.OutboxEvent;
import com.flagship.fiscal_ledger.outbox.OutboxService;
import com.flagship.fiscal_ledger.period.DocumentType;
import com.flagship.fiscal_ledger.period.FiscalPeriod;
import com.flagship.fiscal_ledger.period.FiscalPeriodService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JournalEntryServiceTest {

    private static final Instant NOW = Instant.parse("2025-08-01T10:00:00Z");
    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID ACTOR = UUID.randomUUID();
    private static final UUID PERIOD = UUID.randomUUID();
    private static final UUID CASH = UUID.randomUUID();
    private static final UUID SALES = UUID.randomUUID();

    @Mock
    private JournalEntryRepository repository;

    @Mock
    private FiscalPeriodService periodService;

    @Mock
    private AccountService accountService;

    @Mock
    private OutboxService outboxService;

    private JournalEntryService service;

    @BeforeEach
    void setUp() {
        service = new JournalEntryService(repository, periodService, accountService, outboxService,
            new LedgerMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FiscalPeriod period(boolean closed) {
        return new FiscalPeriod(PERIOD, TENANT, "2082/83", LocalDate.of(2025, 7, 16), LocalDate.of(2026, 7, 15),
            "2082-04-01", "2083-03-32", true, closed, closed ? NOW : null, closed ? ACTOR : null,
            "INV-8283-", "PUR-8283-", "JV-8283-", 0, 0, 0, NOW, NOW);
    }

    private static JournalEntryRequest.JournalEntryRequestBuilder request(String debit, String credit) {
        return JournalEntryRequest.builder()
            .fiscalPeriodId(PERIOD)
            .transactionDate(LocalDate.of(2025, 8, 1))
            .description("Cash sale")
            .line(JournalEntryRequest.Line.debit(CASH, new BigDecimal(debit)))
            .line(JournalEntryRequest.Line.credit(SALES, new BigDecimal(credit)));
    }

    private static JournalEntry storedEntry(JournalStatus status) {
        JournalEntry draft = JournalEntry.draft(TENANT, ACTOR, request("500", "500").build(), null, NOW);
        return new JournalEntry(draft.getId(), TENANT, PERIOD, draft.getTransactionDate(), null,
            draft.getDescription(), null, status, draft.getLines(), ACTOR, NOW,
            status == JournalStatus.POSTED ? NOW : null, status == JournalStatus.POSTED ? ACTOR : null);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("Balanced entry in an open period is stored as DRAFT")
        void storesDraft() {
            when(periodService.get(PERIOD)).thenReturn(period(false));
            when(periodService.getLocked(PERIOD)).thenReturn(period(false));

            JournalEntry entry = service.create(TENANT, ACTOR, request("500", "500").build());

            assertEquals(JournalStatus.DRAFT, entry.getStatus());
            assertNull(entry.getVoucherNumber());
            assertEquals(ACTOR, entry.getCreatedBy());
            verify(accountService).requireAllExist(TENANT, List.of(CASH, SALES));
            verify(repository).insert(entry);
            verify(periodService, never()).generateNumber(any(), any());
        }

        @Test
        @DisplayName("Voucher number comes from the period's JV series")
        void assignsVoucherNumber() {
            when(periodService.get(PERIOD)).thenReturn(period(false));
            when(periodService.generateNumber(PERIOD, DocumentType.VOUCHER)).thenReturn("JV-8283-0007");

            JournalEntry entry = service.create(TENANT, ACTOR, request("500", "500").assignVoucherNumber(true).build());

            assertEquals("JV-8283-0007", entry.getVoucherNumber());
            verify(repository).insert(entry);
            verify(periodService, never()).getLocked(any());
        }

        @Test
        @DisplayName("Closed period is reported as a validation error")
        void closedPeriod() {
            when(periodService.get(PERIOD)).thenReturn(period(true));

            ValidationException e = assertThrows(ValidationException.class,
                () -> service.create(TENANT, ACTOR, request("500", "400").build()));
            assertTrue(e.getMessage().contains("closed"));
            verifyNoInteractions(repository, accountService);
        }

        @Test
        @DisplayName("Period of another tenant is not found")
        void otherTenant() {
            when(periodService.get(PERIOD)).thenReturn(period(false));

            assertThrows(NotFoundException.class,
                () -> service.create(UUID.randomUUID(), ACTOR, request("500", "500").build()));
        }

        @Test
        @DisplayName("Date outside the period is rejected")
        void dateOutsidePeriod() {
            when(periodService.get(PERIOD)).thenReturn(period(false));

            assertThrows(ValidationException.class, () -> service.create(TENANT, ACTOR,
                request("500", "500").transactionDate(LocalDate.of(2026, 7, 16)).build()));
            verifyNoInteractions(accountService);
        }

        @Test
        @DisplayName("Unknown account is not found")
        void unknownAccount() {
            when(periodService.get(PERIOD)).thenReturn(period(false));
            doThrow(NotFoundException.of("Account", SALES)).when(accountService).requireAllExist(eq(TENANT), any());

            assertThrows(NotFoundException.class, () -> service.create(TENANT, ACTOR, request("500", "500").build()));
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("Unbalanced entry consumes no voucher number")
        void unbalanced() {
            when(periodService.get(PERIOD)).thenReturn(period(false));

            assertThrows(ValidationException.class, () -> service.create(TENANT, ACTOR,
                request("500", "400").assignVoucherNumber(true).build()));
            verify(periodService, never()).generateNumber(any(), any());
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("Period closed while validating is still a validation error")
        void closedConcurrently() {
            when(periodService.get(PERIOD)).thenReturn(period(false));
            when(periodService.getLocked(PERIOD)).thenReturn(period(true));

            ValidationException e = assertThrows(ValidationException.class,
                () -> service.create(TENANT, ACTOR, request("500", "500").build()));
            assertInstanceOf(StateException.class, e.getCause());
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("Period closed before the voucher is drawn is a validation error")
        void closedBeforeVoucher() {
            when(periodService.get(PERIOD)).thenReturn(period(false));
            when(periodService.generateNumber(PERIOD, DocumentType.VOUCHER))
                .thenThrow(new StateException("Cannot generate JV number: fiscal period 2082/83 is closed"));

            ValidationException e = assertThrows(ValidationException.class,
                () -> service.create(TENANT, ACTOR, request("500", "500").assignVoucherNumber(true).build()));
            assertTrue(e.getMessage().contains("closed"));
            verifyNoInteractions(repository);
        }
    }

    @Nested
    @DisplayName("post")
    class Post {

        @Test
        @DisplayName("Draft becomes POSTED and an event is written")
        void postsDraft() {
            JournalEntry draft = storedEntry(JournalStatus.DRAFT);
            JournalEntry posted = storedEntry(JournalStatus.POSTED);
            when(repository.findById(draft.getId())).thenReturn(Optional.of(draft), Optional.of(posted));
            when(periodService.getLocked(PERIOD)).thenReturn(period(false));
            when(repository.markPosted(draft.getId(), ACTOR, NOW)).thenReturn(1);

            JournalEntry result = service.post(draft.getId(), ACTOR);

            assertEquals(JournalStatus.POSTED, result.getStatus());
            ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
            verify(outboxService).saveEvent(eq(OutboxEvent.JOURNAL_ENTRY_AGGREGATE), eq(draft.getId()),
                eq(JournalEntryPostedEvent.EVENT_TYPE), payload.capture());
            assertEquals(0, new BigDecimal("500").compareTo(((JournalEntryPostedEvent) payload.getValue()).getTotalAmount()));
        }

        @Test
        @DisplayName("Posting a posted entry is a conflict")
        void alreadyPosted() {
            JournalEntry posted = storedEntry(JournalStatus.POSTED);
            when(repository.findById(posted.getId())).thenReturn(Optional.of(posted));

            assertThrows(ConflictException.class, () -> service.post(posted.getId(), ACTOR));
            verify(repository, never()).markPosted(any(), any(), any());
        }

        @Test
        @DisplayName("Losing a concurrent post is a conflict")
        void concurrentPost() {
            JournalEntry draft = storedEntry(JournalStatus.DRAFT);
            when(repository.findById(draft.getId())).thenReturn(Optional.of(draft));
            when(periodService.getLocked(PERIOD)).thenReturn(period(false));
            when(repository.markPosted(draft.getId(), ACTOR, NOW)).thenReturn(0);

            assertThrows(ConflictException.class, () -> service.post(draft.getId(), ACTOR));
            verifyNoInteractions(outboxService);
        }

        @Test
        @DisplayName("Posting into a closed period is a state error")
        void closedPeriod() {
            JournalEntry draft = storedEntry(JournalStatus.DRAFT);
            when(repository.findById(draft.getId())).thenReturn(Optional.of(draft));
            when(periodService.getLocked(PERIOD)).thenReturn(period(true));

            assertThrows(StateException.class, () -> service.post(draft.getId(), ACTOR));
            verify(repository, never()).markPosted(any(), any(), any());
        }

        @Test
        @DisplayName("Unknown entry is not found")
        void unknownEntry() {
            UUID id = UUID.randomUUID();
            when(repository.findById(id)).thenReturn(Optional.empty());

            assertThrows(NotFoundException.class, () -> service.post(id, ACTOR));
        }
    }
}
