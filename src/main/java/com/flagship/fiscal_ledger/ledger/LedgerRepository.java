package com.flagship.fiscal_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only query over posted journal lines.
 */
@Repository
public class LedgerRepository {

    private final JdbcTemplate jdbcTemplate;

    public LedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Posted lines for the account in {@code [from, to]}, ordered by transaction date,
     * then entry creation order, then line number. Running balance is left at zero.
     */
    public List<LedgerEntry> findPostedLines(UUID tenantId, UUID accountId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT l.id, l.journal_entry_id, l.account_id, l.transaction_date, e.voucher_number, " +
            "       e.description AS entry_description, l.description AS line_description, l.debit, l.credit " +
            "FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.journal_entry_id AND e.transaction_date = l.transaction_date " +
            "WHERE l.account_id = ? AND e.tenant_id = ? AND e.status = 'POSTED' " +
            "  AND l.transaction_date BETWEEN ? AND ? " +
            "ORDER BY l.transaction_date ASC, e.entry_seq ASC, l.line_number ASC",
            (rs, rowNum) -> new LedgerEntry(
                rs.getObject("id", UUID.class),
                rs.getObject("journal_entry_id", UUID.class),
                rs.getObject("account_id", UUID.class),
                rs.getObject("transaction_date", LocalDate.class),
                rs.getString("voucher_number"),
                rs.getString("entry_description"),
                rs.getString("line_description"),
                rs.getBigDecimal("debit"),
                rs.getBigDecimal("credit"),
                BigDecimal.ZERO
            ),
            accountId,
            tenantId,
            from,
            to
        );
    }
}
