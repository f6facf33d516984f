package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

/**
 * A user as saved, with the fields the save changed.
 *
 * @param changedFields names of the properties that were dirty when the user was saved
 * @param groupAliases aliases of the groups the user belongs to after the save
 */
public record SavedUser(
    int id, String name, String email, List<String> changedFields, List<String> groupAliases) {

  public static final String GROUPS_FIELD = "groups";

  public SavedUser {
    changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    groupAliases = groupAliases == null ? List.of() : List.copyOf(groupAliases);
  }

  public boolean groupsChanged() {
    return changedFields.contains(GROUPS_FIELD);
  }
}
