package io.b2mash.b2b.backofficeaudit.formatter;

import io.b2mash.b2b.backofficeaudit.audit.AuditEntry;
import io.b2mash.b2b.backofficeaudit.audit.AuditEventTag;
import io.b2mash.b2b.backofficeaudit.context.ActorContext;
import io.b2mash.b2b.backofficeaudit.directory.ContentEntityDirectory;
import io.b2mash.b2b.backofficeaudit.directory.ContentEntitySummary;
import io.b2mash.b2b.backofficeaudit.directory.MemberDirectory;
import io.b2mash.b2b.backofficeaudit.directory.MemberProfile;
import io.b2mash.b2b.backofficeaudit.directory.UserGroupDirectory;
import io.b2mash.b2b.backofficeaudit.directory.UserGroupProfile;
import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import io.b2mash.b2b.backofficeaudit.event.EntityPermission;
import io.b2mash.b2b.backofficeaudit.event.IdentityAuditEvent;
import io.b2mash.b2b.backofficeaudit.event.MemberRolesAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.MemberRolesRemovedEvent;
import io.b2mash.b2b.backofficeaudit.event.MembersDeletedEvent;
import io.b2mash.b2b.backofficeaudit.event.MembersSavedEvent;
import io.b2mash.b2b.backofficeaudit.event.SavedUser;
import io.b2mash.b2b.backofficeaudit.event.SavedUserGroup;
import io.b2mash.b2b.backofficeaudit.event.UserGroupPermissionsAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.UserGroupsSavedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersDeletedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersSavedEvent;
import io.b2mash.b2b.backofficeaudit.exception.AuditConsistencyException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps audit events to audit entries. Each call captures one timestamp, shared by all entries it
 * returns; apart from that timestamp, equal inputs always render equal entries.
 *
 * <p>Directory lookups (members for role events, groups and entities for permission events) are
 * batched: one call per directory per event.
 */
@Component
public class AuditEntryFormatter {

  /** {@code affectedId} of entries whose subject is not a single identifiable record. */
  public static final int NO_SUBJECT = -1;

  /** {@code affectedId} of sign-in entries, which have no subject at all. */
  public static final int NO_AFFECTED_USER = 0;

  private final Clock clock;
  private final MemberDirectory memberDirectory;
  private final UserGroupDirectory userGroupDirectory;
  private final ContentEntityDirectory contentEntityDirectory;

  public AuditEntryFormatter(
      Clock clock,
      MemberDirectory memberDirectory,
      UserGroupDirectory userGroupDirectory,
      ContentEntityDirectory contentEntityDirectory) {
    this.clock = clock;
    this.memberDirectory = memberDirectory;
    this.userGroupDirectory = userGroupDirectory;
    this.contentEntityDirectory = contentEntityDirectory;
  }

  /**
   * Renders an authentication pipeline event.
   *
   * @param affectedUser the resolved affected user; required when the kind targets a user, ignored
   *     otherwise
   */
  public AuditEntry formatIdentityEvent(
      IdentityAuditEvent event, ActorContext actor, UserProfile affectedUser) {
    var kind = event.kind();
    if (kind.isReserved()) {
      throw new IllegalArgumentException("No audit entry is defined for " + kind);
    }
    String comment =
        switch (kind) {
          case LOGIN_SUCCESS -> "login success";
          case LOGOUT_SUCCESS -> "logout success";
          case LOGIN_FAILED -> "login failed";
          case PASSWORD_RESET -> "password reset";
          case PASSWORD_CHANGED -> "password change";
          case FORGOT_PASSWORD_REQUESTED -> "password forgot/request";
          case FORGOT_PASSWORD_CHANGED -> "password forgot/change";
          default -> throw new IllegalArgumentException(kind + " is not an identity event kind");
        };

    int affectedId = NO_AFFECTED_USER;
    String affectedDetails = null;
    if (kind.targetsUser()) {
      if (affectedUser == null) {
        throw new IllegalArgumentException(kind + " requires the affected user");
      }
      affectedId = affectedUser.id();
      affectedDetails = AuditDetails.user(affectedUser.name(), affectedUser.email());
    }
    return entry(actor, now(), affectedId, affectedDetails, kind.tag(), comment);
  }

  public List<AuditEntry> formatUsersSaved(UsersSavedEvent event, ActorContext actor) {
    Instant timestamp = now();
    var entries = new ArrayList<AuditEntry>(event.savedEntities().size());
    for (SavedUser user : event.savedEntities()) {
      String comment = "updating " + AuditDetails.changeSummary(user.changedFields());
      if (user.groupsChanged()) {
        comment += "; groups assigned: " + AuditDetails.join(user.groupAliases());
      }
      entries.add(
          entry(
              actor,
              timestamp,
              user.id(),
              AuditDetails.user(user.name(), user.email()),
              AuditEventTag.USER_SAVE,
              comment));
    }
    return entries;
  }

  public List<AuditEntry> formatUsersDeleted(UsersDeletedEvent event, ActorContext actor) {
    Instant timestamp = now();
    return event.deletedEntities().stream()
        .map(
            user ->
                entry(
                    actor,
                    timestamp,
                    user.id(),
                    AuditDetails.user(user.name(), user.email()),
                    AuditEventTag.USER_DELETE,
                    "delete user"))
        .toList();
  }

  public List<AuditEntry> formatUserGroupsSaved(UserGroupsSavedEvent event, ActorContext actor) {
    Instant timestamp = now();
    var entries = new ArrayList<AuditEntry>(event.savedEntities().size());
    for (SavedUserGroup group : event.savedEntities()) {
      var comment = new StringBuilder("updating ");
      comment.append(AuditDetails.changeSummary(group.changedFields()));
      // Sections and permissions are recorded by value, other fields by name only
      if (group.allowedSectionsChanged()) {
        comment.append("; assigned sections: ").append(AuditDetails.join(group.allowedSections()));
      }
      if (group.permissionsChanged()) {
        comment.append("; assigned permissions: ").append(AuditDetails.join(group.permissions()));
      }
      entries.add(
          entry(
              actor,
              timestamp,
              group.id(),
              AuditDetails.group(group.id(), group.name(), group.alias()),
              AuditEventTag.USER_GROUP_SAVE,
              comment.toString()));
    }
    return entries;
  }

  /**
   * Renders one entry per assigned permission set.
   *
   * @throws AuditConsistencyException if a referenced group or entity does not exist; no entry is
   *     rendered for the event in that case
   */
  public List<AuditEntry> formatPermissionsAssigned(
      UserGroupPermissionsAssignedEvent event, ActorContext actor) {
    var permissions = event.savedEntities();
    if (permissions.isEmpty()) {
      return List.of();
    }
    var groupIds = new LinkedHashSet<Integer>();
    var entityIds = new LinkedHashSet<Integer>();
    for (EntityPermission permission : permissions) {
      groupIds.add(permission.userGroupId());
      entityIds.add(permission.entityId());
    }
    Map<Integer, UserGroupProfile> groups = userGroupDirectory.findAllByIds(groupIds);
    Map<Integer, ContentEntitySummary> entities = contentEntityDirectory.findAllByIds(entityIds);

    Instant timestamp = now();
    var entries = new ArrayList<AuditEntry>(permissions.size());
    for (EntityPermission permission : permissions) {
      UserGroupProfile group = groups.get(permission.userGroupId());
      if (group == null) {
        throw AuditConsistencyException.missing("user group", permission.userGroupId());
      }
      ContentEntitySummary entity = entities.get(permission.entityId());
      if (entity == null) {
        throw AuditConsistencyException.missing("entity", permission.entityId());
      }
      String comment =
          "assigning %s on id:%d %s for group %s"
              .formatted(
                  AuditDetails.changeSummary(permission.assignedPermissions()),
                  entity.id(),
                  AuditDetails.quote(entity.name()),
                  AuditDetails.quote(group.name()));
      entries.add(
          entry(
              actor,
              timestamp,
              NO_SUBJECT,
              AuditDetails.group(group),
              AuditEventTag.USER_GROUP_PERMISSIONS_CHANGE,
              comment));
    }
    return entries;
  }

  public List<AuditEntry> formatMembersSaved(MembersSavedEvent event, ActorContext actor) {
    Instant timestamp = now();
    return event.savedEntities().stream()
        .map(
            member ->
                entry(
                    actor,
                    timestamp,
                    member.id(),
                    AuditDetails.member(member.id(), member.name(), member.email()),
                    AuditEventTag.MEMBER_SAVE,
                    "updating " + AuditDetails.changeSummary(member.changedFields())))
        .toList();
  }

  public List<AuditEntry> formatMembersDeleted(MembersDeletedEvent event, ActorContext actor) {
    Instant timestamp = now();
    return event.deletedEntities().stream()
        .map(
            member -> {
              String details = AuditDetails.member(member.id(), member.name(), member.email());
              String comment =
                  "delete member id:" + member.id() + " " + AuditDetails.quote(member.name());
              String email = AuditDetails.formatEmail(member.email());
              return entry(
                  actor,
                  timestamp,
                  member.id(),
                  details,
                  AuditEventTag.MEMBER_DELETE,
                  email.isEmpty() ? comment : comment + " " + email);
            })
        .toList();
  }

  public List<AuditEntry> formatRolesAssigned(MemberRolesAssignedEvent event, ActorContext actor) {
    return formatRoleChange(
        event.memberIds(),
        actor,
        AuditEventTag.MEMBER_ROLES_ASSIGNED,
        "roles modified, assigned " + AuditDetails.join(event.roles()));
  }

  public List<AuditEntry> formatRolesRemoved(MemberRolesRemovedEvent event, ActorContext actor) {
    return formatRoleChange(
        event.memberIds(),
        actor,
        AuditEventTag.MEMBER_ROLES_REMOVED,
        "roles modified, removed " + AuditDetails.join(event.roles()));
  }

  /**
   * One entry per member id, all sharing the same comment. Members deleted since the roles changed
   * still get an entry, rendered with an unknown name.
   */
  private List<AuditEntry> formatRoleChange(
      List<Integer> memberIds, ActorContext actor, AuditEventTag tag, String comment) {
    if (memberIds.isEmpty()) {
      return List.of();
    }
    Map<Integer, MemberProfile> members =
        memberDirectory.findAllByIds(new LinkedHashSet<>(memberIds));
    Instant timestamp = now();
    var entries = new ArrayList<AuditEntry>(memberIds.size());
    for (Integer memberId : memberIds) {
      MemberProfile member = members.get(memberId);
      String details =
          member == null
              ? AuditDetails.member(memberId, AuditDetails.UNKNOWN_NAME, null)
              : AuditDetails.member(memberId, member.name(), member.email());
      entries.add(entry(actor, timestamp, memberId, details, tag, comment));
    }
    return entries;
  }

  private Instant now() {
    return clock.instant();
  }

  private static AuditEntry entry(
      ActorContext actor,
      Instant timestamp,
      int affectedId,
      String affectedDetails,
      AuditEventTag tag,
      String comment) {
    return new AuditEntry(
        actor.userId(),
        AuditDetails.performer(actor),
        actor.ipAddress(),
        timestamp,
        affectedId,
        affectedDetails,
        tag,
        comment);
  }
}
