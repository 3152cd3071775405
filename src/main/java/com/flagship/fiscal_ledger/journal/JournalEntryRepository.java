package com.flagship.fiscal_ledger.journal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the partitioned {@code journal_entries} and {@code journal_lines} tables.
 *
 * Lines repeat the entry's transaction date so both tables partition on the same key.
 */
@Repository
public class JournalEntryRepository {

    private static final String ENTRY_COLUMNS =
        "id, tenant_id, fiscal_period_id, transaction_date, voucher_number, description, status, " +
        "reference_id, reference_type, created_by, created_at, posted_at, posted_by";

    private static final String LINE_COLUMNS =
        "id, journal_entry_id, line_number, account_id, debit, credit, description";

    private final JdbcTemplate jdbcTemplate;

    public JournalEntryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the header and all lines. Must run inside a transaction so a
     * failing line leaves no partial entry behind.
     */
    public void insert(JournalEntry entry) {
        JournalReference reference = entry.getReference();
        jdbcTemplate.update(
            "INSERT INTO journal_entries (" + ENTRY_COLUMNS + ", updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getTenantId(),
            entry.getFiscalPeriodId(),
            entry.getTransactionDate(),
            entry.getVoucherNumber(),
            entry.getDescription(),
            entry.getStatus().name(),
            reference != null ? reference.getId() : null,
            reference != null ? reference.getType().name() : null,
            entry.getCreatedBy(),
            toTimestamp(entry.getCreatedAt()),
            toTimestamp(entry.getPostedAt()),
            entry.getPostedBy(),
            toTimestamp(entry.getCreatedAt())
        );

        List<Object[]> batch = new ArrayList<>();
        for (JournalLine line : entry.getLines()) {
            batch.add(new Object[] {
                line.getId(),
                entry.getId(),
                entry.getTransactionDate(),
                line.getLineNumber(),
                line.getAccountId(),
                line.getDebit(),
                line.getCredit(),
                line.getDescription()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (id, journal_entry_id, transaction_date, line_number, account_id, " +
            "debit, credit, description) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            batch
        );
    }

    public Optional<JournalEntry> findById(UUID entryId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE id = ?",
            headerMapper(List.of()),
            entryId
        );
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        JournalEntry header = headers.get(0);
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM journal_lines " +
            "WHERE journal_entry_id = ? AND transaction_date = ? ORDER BY line_number",
            lineMapper(),
            entryId,
            header.getTransactionDate()
        );
        return Optional.of(withLines(header, lines));
    }

    /**
     * Entries of one period, newest first, each with its lines.
     */
    public List<JournalEntry> findByPeriod(UUID tenantId, UUID periodId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries " +
            "WHERE tenant_id = ? AND fiscal_period_id = ? ORDER BY transaction_date DESC, entry_seq DESC",
            headerMapper(List.of()),
            tenantId,
            periodId
        );
        if (headers.isEmpty()) {
            return headers;
        }

        Map<UUID, List<JournalLine>> linesByEntry = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT l.id, l.journal_entry_id, l.line_number, l.account_id, l.debit, l.credit, l.description " +
            "FROM journal_lines l JOIN journal_entries e " +
            "  ON e.id = l.journal_entry_id AND e.transaction_date = l.transaction_date " +
            "WHERE e.tenant_id = ? AND e.fiscal_period_id = ? ORDER BY l.journal_entry_id, l.line_number",
            (RowCallbackHandler) rs -> {
                JournalLine line = lineMapper().mapRow(rs, 0);
                linesByEntry.computeIfAbsent(line.getEntryId(), k -> new ArrayList<>()).add(line);
            },
            tenantId,
            periodId
        );

        return headers.stream()
            .map(h -> withLines(h, linesByEntry.getOrDefault(h.getId(), List.of())))
            .toList();
    }

    /**
     * Moves a DRAFT entry to POSTED. Returns 0 if the entry is missing or no longer a draft,
     * which means another caller posted it first.
     */
    public int markPosted(UUID entryId, UUID actor, Instant at) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET status = 'POSTED', posted_at = ?, posted_by = ?, updated_at = ? " +
            "WHERE id = ? AND status = 'DRAFT'",
            toTimestamp(at),
            actor,
            toTimestamp(at),
            entryId
        );
    }

    private static JournalEntry withLines(JournalEntry header, List<JournalLine> lines) {
        return new JournalEntry(
            header.getId(),
            header.getTenantId(),
            header.getFiscalPeriodId(),
            header.getTransactionDate(),
            header.getVoucherNumber(),
            header.getDescription(),
            header.getReference(),
            header.getStatus(),
            List.copyOf(lines),
            header.getCreatedBy(),
            header.getCreatedAt(),
            header.getPostedAt(),
            header.getPostedBy()
        );
    }

    private RowMapper<JournalEntry> headerMapper(List<JournalLine> lines) {
        return (rs, rowNum) -> {
            String referenceType = rs.getString("reference_type");
            JournalReference reference = referenceType == null ? null : new JournalReference(
                rs.getObject("reference_id", UUID.class),
                JournalReference.Type.valueOf(referenceType));
            return new JournalEntry(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                rs.getObject("fiscal_period_id", UUID.class),
                rs.getObject("transaction_date", LocalDate.class),
                rs.getString("voucher_number"),
                rs.getString("description"),
                reference,
                JournalStatus.valueOf(rs.getString("status")),
                lines,
                rs.getObject("created_by", UUID.class),
                toInstant(rs, "created_at"),
                toInstant(rs, "posted_at"),
                rs.getObject("posted_by", UUID.class)
            );
        };
    }

    private RowMapper<JournalLine> lineMapper() {
        return (rs, rowNum) -> new JournalLine(
            rs.getObject("id", UUID.class),
            rs.getObject("journal_entry_id", UUID.class),
            rs.getInt("line_number"),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getString("description")
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
