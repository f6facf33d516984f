package io.b2mash.b2b.backofficeaudit.event;

import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import java.util.List;

public record UsersDeletedEvent(List<UserProfile> deletedEntities) implements AuditableEvent {

  public UsersDeletedEvent {
    deletedEntities = deletedEntities == null ? List.of() : List.copyOf(deletedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.USERS_DELETED;
  }
}
