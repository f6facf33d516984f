package io.b2mash.b2b.backofficeaudit.formatter;

import io.b2mash.b2b.backofficeaudit.context.ActorContext;
import io.b2mash.b2b.backofficeaudit.directory.UserGroupProfile;
import java.util.List;

/** Text fragments shared by every audit entry rendering. */
public final class AuditDetails {

  /** Rendered in place of an empty change list. */
  public static final String NOTHING = "(nothing)";

  static final String UNKNOWN_NAME = "(unknown)";

  private AuditDetails() {}

  /** {@code <address>}, or an empty string for a blank or absent address. */
  public static String formatEmail(String email) {
    return email == null || email.isBlank() ? "" : "<" + email + ">";
  }

  /** {@code Name <email>}; the system actor renders as {@code SYSTEM}. */
  public static String performer(ActorContext actor) {
    return withEmail(actor.name(), actor.email());
  }

  public static String user(String name, String email) {
    return withEmail("User " + quote(name), email);
  }

  public static String member(int id, String name, String email) {
    return withEmail("Member " + id + " " + quote(name), email);
  }

  public static String group(UserGroupProfile group) {
    return group(group.id(), group.name(), group.alias());
  }

  public static String group(int id, String name, String alias) {
    return "User Group " + id + " " + quote(name) + " (" + alias + ")";
  }

  /** Comma-joined list, or {@link #NOTHING} when empty. */
  public static String changeSummary(List<String> changedFields) {
    String joined = join(changedFields);
    return joined.isBlank() ? NOTHING : joined;
  }

  public static String join(List<String> values) {
    return String.join(", ", values);
  }

  static String quote(String value) {
    return "\"" + (value == null ? "" : value) + "\"";
  }

  private static String withEmail(String subject, String email) {
    String formatted = formatEmail(email);
    return formatted.isEmpty() ? subject : subject + " " + formatted;
  }
}
