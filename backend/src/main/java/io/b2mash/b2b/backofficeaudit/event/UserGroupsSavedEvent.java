package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record UserGroupsSavedEvent(List<SavedUserGroup> savedEntities) implements AuditableEvent {

  public UserGroupsSavedEvent {
    savedEntities = savedEntities == null ? List.of() : List.copyOf(savedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.USER_GROUPS_SAVED;
  }
}
