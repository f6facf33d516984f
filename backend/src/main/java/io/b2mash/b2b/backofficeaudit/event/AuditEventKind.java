package io.b2mash.b2b.backofficeaudit.event;

import io.b2mash.b2b.backofficeaudit.audit.AuditEventTag;

/**
 * Every event kind an {@link AuditEventSource} can raise. Reserved kinds are subscribable but carry
 * no {@link AuditEventTag}; wiring one requires adding a tag first.
 */
public enum AuditEventKind {
  LOGIN_SUCCESS(Category.IDENTITY, AuditEventTag.USER_LOGIN, false, false),
  LOGOUT_SUCCESS(Category.IDENTITY, AuditEventTag.USER_LOGOUT, false, false),
  LOGIN_FAILED(Category.IDENTITY, AuditEventTag.USER_LOGIN_FAILED, true, false),
  PASSWORD_RESET(Category.IDENTITY, AuditEventTag.USER_PASSWORD_RESET, true, true),
  PASSWORD_CHANGED(Category.IDENTITY, AuditEventTag.USER_PASSWORD_CHANGE, true, true),
  FORGOT_PASSWORD_REQUESTED(
      Category.IDENTITY, AuditEventTag.USER_PASSWORD_FORGOT_REQUEST, true, true),
  FORGOT_PASSWORD_CHANGED(
      Category.IDENTITY, AuditEventTag.USER_PASSWORD_FORGOT_CHANGE, false, true),
  ACCOUNT_LOCKED(Category.IDENTITY, null, false, false),
  ACCOUNT_UNLOCKED(Category.IDENTITY, null, false, false),
  LOGIN_REQUIRES_VERIFICATION(Category.IDENTITY, null, false, false),
  RESET_ACCESS_FAILED_COUNT(Category.IDENTITY, null, false, false),

  USERS_SAVED(Category.ADMINISTRATION, AuditEventTag.USER_SAVE, false, false),
  USERS_DELETED(Category.ADMINISTRATION, AuditEventTag.USER_DELETE, false, false),
  USER_GROUPS_SAVED(Category.ADMINISTRATION, AuditEventTag.USER_GROUP_SAVE, false, false),
  USER_GROUP_PERMISSIONS_ASSIGNED(
      Category.ADMINISTRATION, AuditEventTag.USER_GROUP_PERMISSIONS_CHANGE, false, false),
  MEMBERS_SAVED(Category.ADMINISTRATION, AuditEventTag.MEMBER_SAVE, false, false),
  MEMBERS_DELETED(Category.ADMINISTRATION, AuditEventTag.MEMBER_DELETE, false, false),
  MEMBER_ROLES_ASSIGNED(
      Category.ADMINISTRATION, AuditEventTag.MEMBER_ROLES_ASSIGNED, false, false),
  MEMBER_ROLES_REMOVED(Category.ADMINISTRATION, AuditEventTag.MEMBER_ROLES_REMOVED, false, false);

  /** Where the event originates. */
  public enum Category {
    /** Raised by the authentication pipeline; carries its own actor and caller address. */
    IDENTITY,
    /** Raised by user, group and membership administration inside a request. */
    ADMINISTRATION
  }

  private final Category category;
  private final AuditEventTag tag;
  private final boolean skipsUnattributed;
  private final boolean targetsUser;

  AuditEventKind(
      Category category, AuditEventTag tag, boolean skipsUnattributed, boolean targetsUser) {
    this.category = category;
    this.tag = tag;
    this.skipsUnattributed = skipsUnattributed;
    this.targetsUser = targetsUser;
  }

  public Category category() {
    return category;
  }

  /** Tag written for this kind; null for reserved kinds. */
  public AuditEventTag tag() {
    return tag;
  }

  public boolean isReserved() {
    return tag == null;
  }

  /** Whether a negative performing user id means the occurrence is deliberately not audited. */
  public boolean skipsUnattributed() {
    return skipsUnattributed;
  }

  /** Whether the event's affected user id names a user that must be resolved. */
  public boolean targetsUser() {
    return targetsUser;
  }
}
