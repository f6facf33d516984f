package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

/**
 * A user group as saved, with the fields the save changed and the current value of the fields the
 * audit trail annotates.
 */
public record SavedUserGroup(
    int id,
    String name,
    String alias,
    List<String> changedFields,
    List<String> allowedSections,
    List<String> permissions) {

  public static final String ALLOWED_SECTIONS_FIELD = "allowedSections";
  public static final String PERMISSIONS_FIELD = "permissions";

  public SavedUserGroup {
    changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    allowedSections = allowedSections == null ? List.of() : List.copyOf(allowedSections);
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
  }

  public boolean allowedSectionsChanged() {
    return changedFields.contains(ALLOWED_SECTIONS_FIELD);
  }

  public boolean permissionsChanged() {
    return changedFields.contains(PERMISSIONS_FIELD);
  }
}
