package io.b2mash.b2b.backofficeaudit.audit;

/**
 * Durable, append-only target for finished audit entries.
 *
 * <p>Implementations must be safe to call concurrently from many threads. No ordering is
 * guaranteed between entries appended by unrelated events. Implementations own any retry policy;
 * callers never retry.
 */
public interface AuditSink {

  /**
   * Appends a single entry.
   *
   * @throws AuditSinkException if the entry could not be stored
   */
  void append(AuditEntry entry);
}
