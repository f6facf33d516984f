package io.b2mash.b2b.backofficeaudit.audit;

/**
 * Closed vocabulary of audit entry categories. Tag keys are persisted and filtered on by readers of
 * the audit log, so existing keys must never change and new constants require bumping {@link
 * #VOCABULARY_VERSION}.
 */
public enum AuditEventTag {
  USER_LOGIN("backoffice/user/sign-in/login"),
  USER_LOGOUT("backoffice/user/sign-in/logout"),
  USER_LOGIN_FAILED("backoffice/user/sign-in/failed"),
  USER_PASSWORD_RESET("backoffice/user/password/reset"),
  USER_PASSWORD_CHANGE("backoffice/user/password/change"),
  USER_PASSWORD_FORGOT_REQUEST("backoffice/user/password/forgot/request"),
  USER_PASSWORD_FORGOT_CHANGE("backoffice/user/password/forgot/change"),
  USER_SAVE("backoffice/user/save"),
  USER_DELETE("backoffice/user/delete"),
  USER_GROUP_SAVE("backoffice/user-group/save"),
  USER_GROUP_PERMISSIONS_CHANGE("backoffice/user-group/permissions-change"),
  MEMBER_SAVE("backoffice/member/save"),
  MEMBER_DELETE("backoffice/member/delete"),
  MEMBER_ROLES_ASSIGNED("backoffice/member/roles/assigned"),
  MEMBER_ROLES_REMOVED("backoffice/member/roles/removed");

  public static final int VOCABULARY_VERSION = 1;

  private final String key;

  AuditEventTag(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return key;
  }
}
