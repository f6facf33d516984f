package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record UserGroupPermissionsAssignedEvent(List<EntityPermission> savedEntities)
    implements AuditableEvent {

  public UserGroupPermissionsAssignedEvent {
    savedEntities = savedEntities == null ? List.of() : List.copyOf(savedEntities);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.USER_GROUP_PERMISSIONS_ASSIGNED;
  }
}
