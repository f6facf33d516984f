package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record MembersSavedEvent(List<SavedMember> savedEntities) implements AuditableEvent {

  public MembersSavedEvent {
    savedEntities = savedEntities == null ? List.of() : List.copyOf(savedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.MEMBERS_SAVED;
  }
}
