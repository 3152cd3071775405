package com.flagship.fiscal_ledger.ledger;

import com.flagship.fiscal_ledger.account.Account;
import com.flagship.fiscal_ledger.account.AccountService;
import com.flagship.fiscal_ledger.exception.ValidationException;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
import com.flagship.fiscal_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Builds an account's ledger from posted journal lines.
 *
 * Balances are derived, never stored. The running balance starts at zero at
 * {@code from} and accumulates debit minus credit for every account type;
 * no opening balance is carried in from before the range.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerProjector {

    private final LedgerRepository repository;
    private final AccountService accountService;
    private final LedgerMetrics metrics;

    /**
     * @return the projection as an unmodifiable list, possibly empty
     * @throws com.flagship.fiscal_ledger.exception.NotFoundException if the account does not exist for the tenant
     * @throws ValidationException if {@code from} is after {@code to}
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> project(UUID tenantId, UUID accountId, LocalDate from, LocalDate to) {
        long start = System.currentTimeMillis();
        CorrelationContext.putId(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        CorrelationContext.putId(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId);
        try {
            accountService.get(tenantId, accountId);
            return runningBalances(repository.findPostedLines(tenantId, accountId, checkRange(from, to), to));
        } finally {
            metrics.recordLatency("ledger_project", System.currentTimeMillis() - start);
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional(readOnly = true)
    public LedgerSummary summarize(UUID tenantId, UUID accountId, LocalDate from, LocalDate to) {
        Account account = accountService.get(tenantId, accountId);
        return LedgerSummary.of(accountId, account.getType(), from, to, project(tenantId, accountId, from, to));
    }

    static List<LedgerEntry> runningBalances(List<LedgerEntry> lines) {
        List<LedgerEntry> result = new ArrayList<>(lines.size());
        BigDecimal balance = BigDecimal.ZERO;
        for (LedgerEntry line : lines) {
            balance = balance.add(line.getDebit()).subtract(line.getCredit());
            result.add(line.withRunningBalance(balance));
        }
        log.debug("Projected {} ledger lines, closing balance {}", result.size(), balance);
        return Collections.unmodifiableList(result);
    }

    private static LocalDate checkRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Range start " + from + " is after end " + to);
        }
        return from;
    }
}
