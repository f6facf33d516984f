package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record MemberRolesAssignedEvent(List<Integer> memberIds, List<String> roles)
    implements AuditableEvent {

  public MemberRolesAssignedEvent {
    memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  @Override
  public AuditEventKind kind() {
    return AuditEventKind.MEMBER_ROLES_ASSIGNED;
  }
}
