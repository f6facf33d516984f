package io.b2mash.b2b.backofficeaudit.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed {@link AuditSink}. Delegates persistence to {@link AuditLogEntryRepository}.
 *
 * <p>Transaction semantics: {@code append()} participates in the caller's transaction (no
 * REQUIRES_NEW). If the administrative operation rolls back, its audit entries roll back too.
 * Each row is flushed on append so store failures surface here, not at the caller's commit.
 */
@Service
public class DatabaseAuditSink implements AuditSink {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditSink.class);

  private final AuditLogEntryRepository auditLogEntryRepository;

  public DatabaseAuditSink(AuditLogEntryRepository auditLogEntryRepository) {
    this.auditLogEntryRepository = auditLogEntryRepository;
  }

  @Override
  @Transactional
  public void append(AuditEntry entry) {
    try {
      auditLogEntryRepository.saveAndFlush(new AuditLogEntry(entry));
    } catch (DataAccessException e) {
      throw new AuditSinkException(
          "Failed to append audit entry of type " + entry.eventTypeTag(), e);
    }
    log.debug(
        "Appended audit entry: type={}, performer={}, affected={}",
        entry.eventTypeTag(),
        entry.performingUserId(),
        entry.affectedId());
  }
}
