package io.b2mash.b2b.backofficeaudit.event;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * {@link AuditEventSource} fed by Spring's {@code ApplicationEventPublisher}. Administration and
 * authentication services publish {@link AuditableEvent} records; this listener runs in the
 * publisher's thread (and transaction, if any) and forwards each event to the handlers subscribed
 * for its kind.
 */
@Component
public class ApplicationAuditEventSource implements AuditEventSource {

  private static final Logger log = LoggerFactory.getLogger(ApplicationAuditEventSource.class);

  private static final Map<AuditEventKind, Class<? extends AuditableEvent>> PAYLOAD_TYPES =
      payloadTypes();

  private final Map<AuditEventKind, List<Consumer<AuditableEvent>>> handlers =
      new EnumMap<>(AuditEventKind.class);

  public ApplicationAuditEventSource() {
    for (AuditEventKind kind : AuditEventKind.values()) {
      handlers.put(kind, new CopyOnWriteArrayList<>());
    }
  }

  @Override
  public <E extends AuditableEvent> void subscribe(
      AuditEventKind kind, Class<E> payloadType, Consumer<? super E> handler) {
    Class<? extends AuditableEvent> expected = PAYLOAD_TYPES.get(kind);
    if (!payloadType.equals(expected)) {
      throw new IllegalArgumentException(
          "Events of kind " + kind + " are raised as " + expected.getSimpleName());
    }
    handlers.get(kind).add(event -> handler.accept(payloadType.cast(event)));
    log.debug("Subscribed handler for audit event kind {}", kind);
  }

  @EventListener
  public void onAuditableEvent(AuditableEvent event) {
    raise(event);
  }

  /** Delivers {@code event} to its subscribers in subscription order. */
  public void raise(AuditableEvent event) {
    var subscribers = handlers.get(event.kind());
    if (subscribers.isEmpty()) {
      log.debug("No audit handler subscribed for {}, dropping event", event.kind());
      return;
    }
    for (Consumer<AuditableEvent> subscriber : subscribers) {
      subscriber.accept(event);
    }
  }

  public int subscriberCount(AuditEventKind kind) {
    return handlers.get(kind).size();
  }

  private static Map<AuditEventKind, Class<? extends AuditableEvent>> payloadTypes() {
    var types = new EnumMap<AuditEventKind, Class<? extends AuditableEvent>>(AuditEventKind.class);
    for (AuditEventKind kind : AuditEventKind.values()) {
      if (kind.category() == AuditEventKind.Category.IDENTITY) {
        types.put(kind, IdentityAuditEvent.class);
      }
    }
    types.put(AuditEventKind.USERS_SAVED, UsersSavedEvent.class);
    types.put(AuditEventKind.USERS_DELETED, UsersDeletedEvent.class);
    types.put(AuditEventKind.USER_GROUPS_SAVED, UserGroupsSavedEvent.class);
    types.put(
        AuditEventKind.USER_GROUP_PERMISSIONS_ASSIGNED, UserGroupPermissionsAssignedEvent.class);
    types.put(AuditEventKind.MEMBERS_SAVED, MembersSavedEvent.class);
    types.put(AuditEventKind.MEMBERS_DELETED, MembersDeletedEvent.class);
    types.put(AuditEventKind.MEMBER_ROLES_ASSIGNED, MemberRolesAssignedEvent.class);
    types.put(AuditEventKind.MEMBER_ROLES_REMOVED, MemberRolesRemovedEvent.class);
    return types;
  }
}
