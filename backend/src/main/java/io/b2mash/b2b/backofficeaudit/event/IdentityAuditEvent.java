package io.b2mash.b2b.backofficeaudit.event;

import java.util.Objects;

/**
 * Authentication pipeline event. Raised outside a web request, so it carries the actor and caller
 * address itself.
 *
 * @param kind an {@link AuditEventKind.Category#IDENTITY} kind
 * @param performingUserId acting user; negative when the pipeline could not attribute the attempt
 * @param affectedUserId user whose credentials were touched; ignored by kinds that target nobody
 * @param ipAddress caller address as seen by the authentication pipeline; may be null
 */
public record IdentityAuditEvent(
    AuditEventKind kind, int performingUserId, int affectedUserId, String ipAddress)
    implements AuditableEvent {

  public IdentityAuditEvent {
    Objects.requireNonNull(kind, "kind");
    if (kind.category() != AuditEventKind.Category.IDENTITY) {
      throw new IllegalArgumentException(kind + " is not an identity event kind");
    }
  }

  public static IdentityAuditEvent of(AuditEventKind kind, int performingUserId, String ipAddress) {
    return new IdentityAuditEvent(kind, performingUserId, performingUserId, ipAddress);
  }
}
