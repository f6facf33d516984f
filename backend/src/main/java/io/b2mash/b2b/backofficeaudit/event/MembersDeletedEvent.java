package io.b2mash.b2b.backofficeaudit.event;

import io.b2mash.b2b.backofficeaudit.directory.MemberProfile;
import java.util.List;

public record MembersDeletedEvent(List<MemberProfile> deletedEntities) implements AuditableEvent {

  public MembersDeletedEvent {
    deletedEntities = deletedEntities == null ? List.of() : List.copyOf(deletedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.MEMBERS_DELETED;
  }
}
