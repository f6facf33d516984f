package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

/** Permission letters assigned to a user group on one content entity. */
public record EntityPermission(int userGroupId, int entityId, List<String> assignedPermissions) {

  public EntityPermission {
    assignedPermissions =
        assignedPermissions == null ? List.of() : List.copyOf(assignedPermissions);
  }
}
