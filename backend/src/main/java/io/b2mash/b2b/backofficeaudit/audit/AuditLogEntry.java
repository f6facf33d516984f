package io.b2mash.b2b.backofficeaudit.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the append-only {@code audit_entries} table. Once created, rows cannot be updated
 * (enforced by a database trigger). No {@code @Version}, no {@code updatedAt}, no setters.
 *
 * @see AuditEntry
 */
@Entity
@Table(name = "audit_entries")
public class AuditLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "performing_user_id", nullable = false, updatable = false)
  private int performingUserId;

  @Column(
      name = "performing_details",
      nullable = false,
      updatable = false,
      columnDefinition = "TEXT")
  private String performingDetails;

  @Column(name = "performing_ip", nullable = false, updatable = false, length = 64)
  private String performingIp;

  @Column(name = "event_date", nullable = false, updatable = false)
  private Instant eventDate;

  @Column(name = "affected_id", nullable = false, updatable = false)
  private int affectedId;

  @Column(name = "affected_details", updatable = false, columnDefinition = "TEXT")
  private String affectedDetails;

  @Column(name = "event_type", nullable = false, updatable = false, length = 256)
  private String eventType;

  @Column(name = "event_details", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String eventDetails;

  /** Protected no-arg constructor required by JPA. */
  protected AuditLogEntry() {}

  public AuditLogEntry(AuditEntry entry) {
    this.performingUserId = entry.performingUserId();
    this.performingDetails = entry.performingDetails();
    this.performingIp = entry.performingIp();
    this.eventDate = entry.timestamp();
    this.affectedId = entry.affectedId();
    this.affectedDetails = entry.affectedDetails();
    this.eventType = entry.eventTypeTag();
    this.eventDetails = entry.comment();
  }

  public UUID getId() {
    return id;
  }

  public int getPerformingUserId() {
    return performingUserId;
  }

  public String getPerformingDetails() {
    return performingDetails;
  }

  public String getPerformingIp() {
    return performingIp;
  }

  public Instant getEventDate() {
    return eventDate;
  }

  public int getAffectedId() {
    return affectedId;
  }

  public String getAffectedDetails() {
    return affectedDetails;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEventDetails() {
    return eventDetails;
  }
}
