package com.flagship.fiscal_ledger.period;

import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code fiscal_periods}.
 *
 * State changes that race (closing, reopening, deleting, counter increments) are
 * single conditional statements; the caller learns from the affected row count
 * whether its precondition still held.
 */
@Repository
public class FiscalPeriodRepository {

    private static final String COLUMNS =
        "id, tenant_id, name, start_date, end_date, start_date_secondary, end_date_secondary, " +
        "is_current, is_closed, closed_at, closed_by, invoice_prefix, purchase_prefix, voucher_prefix, " +
        "last_invoice_num, last_purchase_num, last_voucher_num, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public FiscalPeriodRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the tenant already has a period with this name
     */
    public void insert(FiscalPeriod period) {
        jdbcTemplate.update(
            "INSERT INTO fiscal_periods (" + COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            period.getId(),
            period.getTenantId(),
            period.getName(),
            period.getStartDate(),
            period.getEndDate(),
            period.getStartDateSecondary(),
            period.getEndDateSecondary(),
            period.isCurrent(),
            period.isClosed(),
            toTimestamp(period.getClosedAt()),
            period.getClosedBy(),
            period.getInvoicePrefix(),
            period.getPurchasePrefix(),
            period.getVoucherPrefix(),
            period.getLastInvoiceNum(),
            period.getLastPurchaseNum(),
            period.getLastVoucherNum(),
            toTimestamp(period.getCreatedAt()),
            toTimestamp(period.getUpdatedAt())
        );
    }

    public Optional<FiscalPeriod> findById(UUID id) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM fiscal_periods WHERE id = ?",
            rowMapper(),
            id
        ).stream().findFirst();
    }

    /**
     * Reads the period under a share lock. Closing updates the row, so it waits
     * until the locking transaction ends.
     */
    public Optional<FiscalPeriod> findByIdForShare(UUID id) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM fiscal_periods WHERE id = ? FOR SHARE",
            rowMapper(),
            id
        ).stream().findFirst();
    }

    public List<FiscalPeriod> findByTenant(UUID tenantId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM fiscal_periods WHERE tenant_id = ? ORDER BY start_date, name",
            rowMapper(),
            tenantId
        );
    }

    public Optional<FiscalPeriod> findCurrent(UUID tenantId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM fiscal_periods WHERE tenant_id = ? AND is_current",
            rowMapper(),
            tenantId
        ).stream().findFirst();
    }

    /**
     * Number of periods across all tenants by state, keyed {@code open} and {@code closed}.
     */
    public Map<String, Long> countByState() {
        Map<String, Long> counts = new HashMap<>(Map.of("open", 0L, "closed", 0L));
        jdbcTemplate.query(
            "SELECT is_closed, COUNT(*) AS n FROM fiscal_periods GROUP BY is_closed",
            (RowCallbackHandler) rs -> counts.put(rs.getBoolean("is_closed") ? "closed" : "open", rs.getLong("n"))
        );
        return counts;
    }

    /**
     * Row-locks every period of the tenant until the surrounding transaction ends.
     * Concurrent current-period switches for one tenant queue up behind this lock.
     */
    public List<UUID> lockTenantPeriods(UUID tenantId) {
        return jdbcTemplate.query(
            "SELECT id FROM fiscal_periods WHERE tenant_id = ? ORDER BY id FOR UPDATE",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            tenantId
        );
    }

    public int clearCurrent(UUID tenantId, Instant at) {
        return jdbcTemplate.update(
            "UPDATE fiscal_periods SET is_current = false, updated_at = ? WHERE tenant_id = ? AND is_current",
            toTimestamp(at),
            tenantId
        );
    }

    public int markCurrent(UUID periodId, UUID tenantId, Instant at) {
        return jdbcTemplate.update(
            "UPDATE fiscal_periods SET is_current = true, updated_at = ? WHERE id = ? AND tenant_id = ?",
            toTimestamp(at),
            periodId,
            tenantId
        );
    }

    /**
     * Closes the period if it is still open. Returns 0 when it was already closed.
     */
    public int markClosed(UUID periodId, UUID actor, Instant at) {
        return jdbcTemplate.update(
            "UPDATE fiscal_periods SET is_closed = true, closed_at = ?, closed_by = ?, updated_at = ? " +
            "WHERE id = ? AND NOT is_closed",
            toTimestamp(at),
            actor,
            toTimestamp(at),
            periodId
        );
    }

    /**
     * Reopens the period if it is still closed. Returns 0 when it was already open.
     */
    public int markReopened(UUID periodId, Instant at) {
        return jdbcTemplate.update(
            "UPDATE fiscal_periods SET is_closed = false, closed_at = NULL, closed_by = NULL, updated_at = ? " +
            "WHERE id = ? AND is_closed",
            toTimestamp(at),
            periodId
        );
    }

    /**
     * Deletes the period only while it is neither current nor closed.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if journal entries still reference it
     */
    public int deleteIfDeletable(UUID periodId) {
        return jdbcTemplate.update(
            "DELETE FROM fiscal_periods WHERE id = ? AND NOT is_current AND NOT is_closed",
            periodId
        );
    }

    /**
     * Advances one document counter by exactly one and returns the new value.
     *
     * The read-modify-write happens inside a single UPDATE, so concurrent callers
     * serialize on the row lock and each observes a distinct value. The closed check
     * is part of the same statement: a period closed concurrently never issues
     * another number. Empty when the period does not exist or is closed.
     *
     * Only transient failures are retried. They abort the statement before commit,
     * so a retry never issues a number twice. When called inside an outer
     * transaction a failure aborts that transaction and the retry fails as well,
     * which surfaces the original error to the caller.
     */
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${ledger.numbering.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${ledger.numbering.backoff-ms:50}",
            multiplier = 2.0
        )
    )
    public Optional<IssuedNumber> incrementCounter(UUID periodId, DocumentType type) {
        String counter = type.counterColumn();
        String prefix = type.prefixColumn();
        return jdbcTemplate.query(
            "UPDATE fiscal_periods SET " + counter + " = " + counter + " + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND NOT is_closed " +
            "RETURNING " + prefix + " AS prefix, " + counter + " AS counter",
            (rs, rowNum) -> new IssuedNumber(rs.getString("prefix"), rs.getLong("counter")),
            periodId
        ).stream().findFirst();
    }

    private RowMapper<FiscalPeriod> rowMapper() {
        return (rs, rowNum) -> new FiscalPeriod(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getString("name"),
            rs.getObject("start_date", LocalDate.class),
            rs.getObject("end_date", LocalDate.class),
            rs.getString("start_date_secondary"),
            rs.getString("end_date_secondary"),
            rs.getBoolean("is_current"),
            rs.getBoolean("is_closed"),
            toInstant(rs, "closed_at"),
            rs.getObject("closed_by", UUID.class),
            rs.getString("invoice_prefix"),
            rs.getString("purchase_prefix"),
            rs.getString("voucher_prefix"),
            rs.getLong("last_invoice_num"),
            rs.getLong("last_purchase_num"),
            rs.getLong("last_voucher_num"),
            toInstant(rs, "created_at"),
            toInstant(rs, "updated_at")
        );
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
