package com.bank.governance.audit;

/**
 * An append-only audit row. Implementations are immutable.
 */
public interface AuditEvent {

    /** Primary key of the row within its set. */
    String getEventId();

    /** Epoch millis at which the audited decision was made. */
    long getTimestamp();
}
