package io.b2mash.b2b.backofficeaudit.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogEntryRepository extends JpaRepository<AuditLogEntry, UUID> {

  List<AuditLogEntry> findByEventTypeOrderByEventDateAsc(String eventType);

  List<AuditLogEntry> findByPerformingUserIdOrderByEventDateAsc(int performingUserId);
}
