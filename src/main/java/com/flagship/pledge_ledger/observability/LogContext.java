package com.flagship.pledge_ledger.observability;

import com.flagship.pledge_ledger.payment.LedgerKind;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys the ledger logs with, and helpers to manage them.
 *
 * {@code correlationId} ties log lines and notifications to one request;
 * {@code entryId} names the record being worked on, as {@code PLEDGE:42}.
 */
public final class LogContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String RECORD_KEY = "entryId";

    private LogContext() {
    }

    /**
     * The current request's correlation id. Outside a request each call gets
     * a fresh id; nothing is left behind in MDC on pooled threads.
     */
    public static String correlationId() {
        String id = MDC.get(CORRELATION_ID_KEY);
        return id != null ? id : newCorrelationId();
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String recordTag(LedgerKind kind, long recordId) {
        return kind.name() + ":" + recordId;
    }

    /**
     * Tags log lines with a record until the scope closes, then restores
     * whatever tag was there before.
     */
    public static RecordScope forRecord(LedgerKind kind, long recordId) {
        String previous = MDC.get(RECORD_KEY);
        MDC.put(RECORD_KEY, recordTag(kind, recordId));
        return new RecordScope(previous);
    }

    public static final class RecordScope implements AutoCloseable {

        private final String previous;

        private RecordScope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.remove(RECORD_KEY);
            } else {
                MDC.put(RECORD_KEY, previous);
            }
        }
    }
}
