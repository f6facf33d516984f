package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record UsersSavedEvent(List<SavedUser> savedEntities) implements AuditableEvent {

  public UsersSavedEvent {
    savedEntities = savedEntities == null ? List.of() : List.copyOf(savedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.USERS_SAVED;
  }
}
