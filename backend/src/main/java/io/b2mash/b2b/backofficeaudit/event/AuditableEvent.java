package io.b2mash.b2b.backofficeaudit.event;

/**
 * Base interface for all events the audit trail listens to. Implementations are records carrying
 * plain values only (ids, names, explicit change lists), never live entities, so an event stays
 * valid after the raising operation has moved on.
 */
public sealed interface AuditableEvent
    permits IdentityAuditEvent,
        UsersSavedEvent,
        UsersDeletedEvent,
        UserGroupsSavedEvent,
        UserGroupPermissionsAssignedEvent,
        MembersSavedEvent,
        MembersDeletedEvent,
        MemberRolesAssignedEvent,
        MemberRolesRemovedEvent {

  AuditEventKind kind();
}
