package com.flagship.fiscal_ledger.period;

import com.flagship.fiscal_ledger.exception.ConflictException;
import com.flagship.fiscal_ledger.exception.NotFoundException;
import com.flagship.fiscal_ledger.exception.StateException;
import com.flagship.fiscal_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fiscal period lifecycle and numbering against PostgreSQL, including the
 * concurrent cases the store has to serialize.
 */
class FiscalPeriodIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    private FiscalPeriodService periodService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
    }

    @Nested
    @DisplayName("Document numbering")
    class Numbering {

        @Test
        @DisplayName("Scenario A: 2082/83 issues INV-8283-0001 to 0003")
        void scenarioA() {
            FiscalPeriod period = periodService.createFromName(tenantId, "2082/83");

            assertEquals("2082-04-01", period.getStartDateSecondary());
            assertEquals("2083-03-32", period.getEndDateSecondary());
            assertEquals("INV-8283-0001", periodService.generateInvoiceNumber(period.getId()));
            assertEquals("INV-8283-0002", periodService.generateInvoiceNumber(period.getId()));
            assertEquals("INV-8283-0003", periodService.generateInvoiceNumber(period.getId()));
            assertEquals(3, periodService.get(period.getId()).getLastInvoiceNum());
        }

        @Test
        @DisplayName("Each document type has its own series")
        void independentSeries() {
            FiscalPeriod period = periodService.createFromName(tenantId, "2082/83");

            assertEquals("INV-8283-0001", periodService.generateInvoiceNumber(period.getId()));
            assertEquals("PUR-8283-0001", periodService.generatePurchaseNumber(period.getId()));
            assertEquals("JV-8283-0001", periodService.generateVoucherNumber(period.getId()));
            assertEquals("INV-8283-0002", periodService.generateInvoiceNumber(period.getId()));
        }

        @Test
        @DisplayName("Scenario D: closed period refuses numbers; after reopen the series continues")
        void scenarioD() {
            FiscalPeriod period = periodService.createFromName(tenantId, "2082/83");
            periodService.generateInvoiceNumber(period.getId());
            periodService.generateInvoiceNumber(period.getId());

            periodService.close(period.getId(), UUID.randomUUID());
            assertThrows(StateException.class, () -> periodService.generateInvoiceNumber(period.getId()));
            assertEquals(2, periodService.get(period.getId()).getLastInvoiceNum());

            periodService.reopen(period.getId());
            assertEquals("INV-8283-0003", periodService.generateInvoiceNumber(period.getId()));
        }

        @Test
        @DisplayName("Concurrent callers never receive the same number")
        void concurrentNumbersAreUnique() throws InterruptedException {
            FiscalPeriod period = periodService.createFromName(tenantId, "2082/83");
            int threads = 16;
            int perThread = 25;

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            List<String> issued = Collections.synchronizedList(new ArrayList<>());
            AtomicInteger failures = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int n = 0; n < perThread; n++) {
                            issued.add(periodService.generateInvoiceNumber(period.getId()));
                        }
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            int total = threads * perThread;
            assertEquals(0, failures.get());
            assertEquals(total, issued.size());
            assertEquals(total, new HashSet<>(issued).size(), "numbers must be unique");
            assertTrue(issued.contains("INV-8283-0001"));
            assertTrue(issued.contains(DocumentType.format("INV-8283-", total)));
            assertEquals(total, periodService.get(period.getId()).getLastInvoiceNum());
        }
    }

    @Nested
    @DisplayName("Current period")
    class CurrentPeriod {

        @Test
        @DisplayName("Switching moves the flag; the old period is no longer current")
        void switchCurrent() {
            FiscalPeriod first = periodService.createFromName(tenantId, "2081/82");
            FiscalPeriod second = periodService.createFromName(tenantId, "2082/83");

            periodService.setAsCurrent(tenantId, first.getId());
            periodService.setAsCurrent(tenantId, second.getId());

            assertEquals(second.getId(), periodService.getCurrent(tenantId).getId());
            assertFalse(periodService.get(first.getId()).isCurrent());
        }

        @Test
        @DisplayName("Tenant without a current period gets not found")
        void noCurrent() {
            periodService.createFromName(tenantId, "2082/83");

            assertThrows(NotFoundException.class, () -> periodService.getCurrent(tenantId));
        }

        @Test
        @DisplayName("Concurrent switches leave exactly one current period")
        void concurrentSwitches() throws InterruptedException {
            List<UUID> ids = new ArrayList<>();
            for (int year = 2080; year <= 2084; year++) {
                ids.add(periodService.createFromName(tenantId, String.format("%d/%02d", year, (year + 1) % 100)).getId());
            }

            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger failures = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                UUID target = ids.get(i % ids.size());
                executor.submit(() -> {
                    try {
                        start.await();
                        periodService.setAsCurrent(tenantId, target);
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(0, failures.get());
            Integer current = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM fiscal_periods WHERE tenant_id = ? AND is_current", Integer.class, tenantId);
            assertEquals(1, current);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Duplicate name for the same tenant is a conflict; other tenants are unaffected")
        void duplicateName() {
            periodService.createFromName(tenantId, "2082/83");

            assertThrows(ConflictException.class, () -> periodService.createFromName(tenantId, "2082/83"));
            assertDoesNotThrow(() -> periodService.createFromName(UUID.randomUUID(), "2082/83"));
        }

        @Test
        @DisplayName("Explicit dates derive secondary bounds")
        void explicitDates() {
            FiscalPeriod period = periodService.create(tenantId, "2081/82",
                LocalDate.of(2024, 7, 16), LocalDate.of(2025, 7, 15));

            assertEquals("INV-8182-", period.getInvoicePrefix());
            assertEquals(LocalDate.of(2025, 7, 15), periodService.get(period.getId()).getEndDate());
        }

        @Test
        @DisplayName("Closing twice is a state error and keeps the first actor")
        void closeTwice() {
            FiscalPeriod period = periodService.createFromName(tenantId, "2082/83");
            UUID actor = UUID.randomUUID();

            FiscalPeriod closed = periodService.close(period.getId(), actor);

            assertTrue(closed.isClosed());
            assertEquals(actor, closed.getClosedBy());
            assertNotNull(closed.getClosedAt());
            assertThrows(StateException.class, () -> periodService.close(period.getId(), UUID.randomUUID()));
            assertEquals(actor, periodService.get(period.getId()).getClosedBy());
        }

        @Test
        @DisplayName("Current and closed periods cannot be deleted; an open one can")
        void delete() {
            FiscalPeriod current = periodService.createFromName(tenantId, "2081/82");
            FiscalPeriod closed = periodService.createFromName(tenantId, "2082/83");
            FiscalPeriod open = periodService.createFromName(tenantId, "2083/84");
            periodService.setAsCurrent(tenantId, current.getId());
            periodService.close(closed.getId(), UUID.randomUUID());

            assertThrows(StateException.class, () -> periodService.delete(current.getId()));
            assertThrows(StateException.class, () -> periodService.delete(closed.getId()));
            periodService.delete(open.getId());

            assertThrows(NotFoundException.class, () -> periodService.get(open.getId()));
            Set<UUID> remaining = new HashSet<>();
            periodService.listForTenant(tenantId).forEach(p -> remaining.add(p.getId()));
            assertEquals(Set.of(current.getId(), closed.getId()), remaining);
        }

        @Test
        @DisplayName("Periods are listed in start date order")
        void listOrder() {
            periodService.createFromName(tenantId, "2083/84");
            periodService.createFromName(tenantId, "2081/82");
            periodService.createFromName(tenantId, "2082/83");

            List<String> names = periodService.listForTenant(tenantId).stream().map(FiscalPeriod::getName).toList();

            assertEquals(List.of("2081/82", "2082/83", "2083/84"), names);
        }
    }
}
