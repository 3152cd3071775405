package com.flagship.fiscal_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread request context for log correlation.
 *
 * The correlation id lives for the whole request and is copied onto every outbox
 * event written during it. Domain ids (tenant, period, entry, account) are put into
 * the MDC by the service handling an operation and removed when it returns.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ACTOR_ID_HEADER = "X-Actor-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACTOR_ID_MDC_KEY = "actorId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String PERIOD_ID_MDC_KEY = "periodId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final String[] DOMAIN_KEYS = {
        TENANT_ID_MDC_KEY, PERIOD_ID_MDC_KEY, ENTRY_ID_MDC_KEY, ACCOUNT_ID_MDC_KEY
    };

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * The request's correlation id. Work started outside a request (scheduled jobs,
     * tests) gets a fresh id on first use.
     */
    public static String getCorrelationId() {
        String id = CURRENT.get();
        if (id == null) {
            id = newCorrelationId();
            CURRENT.set(id);
        }
        return id;
    }

    /**
     * Binds the caller's id, or a new one when the caller sent none, to the thread and the MDC.
     */
    public static String begin(String requestedId) {
        String id = requestedId != null && !requestedId.isBlank() ? requestedId.trim() : newCorrelationId();
        CURRENT.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Drops everything this class or the services put on the thread.
     */
    public static void end() {
        CURRENT.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ACTOR_ID_MDC_KEY);
        clearDomainIds();
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts an id into the MDC; null ids are skipped.
     */
    public static void putId(String key, UUID id) {
        if (id != null) {
            MDC.put(key, id.toString());
        }
    }

    public static void clearDomainIds() {
        for (String key : DOMAIN_KEYS) {
            MDC.remove(key);
        }
    }
}
