package io.b2mash.b2b.backofficeaudit.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * A single, immutable audit trail entry. Handed to {@link AuditSink#append(AuditEntry)} exactly
 * once.
 *
 * @param performingUserId id of the actor; {@code 0} is the system pseudo-identity
 * @param performingDetails rendered actor, e.g. {@code Alice <alice@example.com>}
 * @param performingIp caller address; empty when unknown
 * @param timestamp capture time, assigned when the entry is formatted
 * @param affectedId id of the subject; {@code 0} or {@code -1} when there is no specific subject
 * @param affectedDetails rendered subject; null for events without a subject
 * @param eventTypeTag category key from {@link AuditEventTag}
 * @param comment description of the specific change
 */
public record AuditEntry(
    int performingUserId,
    String performingDetails,
    String performingIp,
    Instant timestamp,
    int affectedId,
    String affectedDetails,
    String eventTypeTag,
    String comment) {

  public AuditEntry {
    if (performingUserId < 0) {
      throw new IllegalArgumentException(
          "performingUserId must not be negative, was " + performingUserId);
    }
    Objects.requireNonNull(performingDetails, "performingDetails");
    Objects.requireNonNull(performingIp, "performingIp");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(eventTypeTag, "eventTypeTag");
    Objects.requireNonNull(comment, "comment");
  }

  public AuditEntry(
      int performingUserId,
      String performingDetails,
      String performingIp,
      Instant timestamp,
      int affectedId,
      String affectedDetails,
      AuditEventTag tag,
      String comment) {
    this(
        performingUserId,
        performingDetails,
        performingIp,
        timestamp,
        affectedId,
        affectedDetails,
        tag.key(),
        comment);
  }
}
