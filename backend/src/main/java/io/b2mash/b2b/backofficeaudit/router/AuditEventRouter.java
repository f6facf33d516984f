package io.b2mash.b2b.backofficeaudit.router;

import io.b2mash.b2b.backofficeaudit.audit.AuditEntry;
import io.b2mash.b2b.backofficeaudit.audit.AuditSink;
import io.b2mash.b2b.backofficeaudit.audit.AuditSinkException;
import io.b2mash.b2b.backofficeaudit.audit.AuditTrailProperties;
import io.b2mash.b2b.backofficeaudit.context.ActorContext;
import io.b2mash.b2b.backofficeaudit.context.PerformingContextResolver;
import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import io.b2mash.b2b.backofficeaudit.event.AuditEventKind;
import io.b2mash.b2b.backofficeaudit.event.AuditEventSource;
import io.b2mash.b2b.backofficeaudit.event.AuditableEvent;
import io.b2mash.b2b.backofficeaudit.event.IdentityAuditEvent;
import io.b2mash.b2b.backofficeaudit.event.MemberRolesAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.MemberRolesRemovedEvent;
import io.b2mash.b2b.backofficeaudit.event.MembersDeletedEvent;
import io.b2mash.b2b.backofficeaudit.event.MembersSavedEvent;
import io.b2mash.b2b.backofficeaudit.event.UserGroupPermissionsAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.UserGroupsSavedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersDeletedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersSavedEvent;
import io.b2mash.b2b.backofficeaudit.exception.AuditConsistencyException;
import io.b2mash.b2b.backofficeaudit.formatter.AuditEntryFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Subscribes to the audit event source once at startup and turns every raised event into audit
 * entries: resolve the performing context, format, append each entry to the sink.
 *
 * <p>Handlers run inline on the raising thread and keep no state between invocations. Failures
 * are not retried: an {@link AuditConsistencyException} or {@link AuditSinkException} propagates to
 * the raising side, which decides whether the audited action itself fails.
 *
 * <p>Reserved kinds ({@link AuditEventKind#isReserved()}) are never subscribed.
 *
 * <p>Registration happens once every singleton is instantiated, ahead of the refresh-completed
 * event and of any {@code ApplicationRunner}. Events raised from bean constructors or
 * {@code @PostConstruct} methods precede it and are dropped by the source.
 */
@Component
public class AuditEventRouter implements SmartInitializingSingleton {

  private static final Logger log = LoggerFactory.getLogger(AuditEventRouter.class);

  static final String MDC_EVENT_KIND = "auditEventKind";

  private final AuditEventSource eventSource;
  private final PerformingContextResolver contextResolver;
  private final AuditEntryFormatter formatter;
  private final AuditSink sink;
  private final AuditTrailProperties properties;

  private final AtomicReference<RouterState> state =
      new AtomicReference<>(RouterState.UNREGISTERED);
  private volatile List<AuditEventKind> subscriptions = List.of();

  public AuditEventRouter(
      AuditEventSource eventSource,
      PerformingContextResolver contextResolver,
      AuditEntryFormatter formatter,
      AuditSink sink,
      AuditTrailProperties properties) {
    this.eventSource = eventSource;
    this.contextResolver = contextResolver;
    this.formatter = formatter;
    this.sink = sink;
    this.properties = properties;
  }

  @Override
  public void afterSingletonsInstantiated() {
    if (!properties.enabled()) {
      log.info("Audit trail disabled (audit.trail.enabled=false) -- not subscribing to events");
      return;
    }
    register();
  }

  /** Subscribes one handler per wired event kind. Calling it again has no effect. */
  public void register() {
    if (!state.compareAndSet(RouterState.UNREGISTERED, RouterState.REGISTERED)) {
      log.warn("Audit event router already registered, ignoring repeated registration");
      return;
    }
    var subscribed = new ArrayList<AuditEventKind>();
    for (AuditEventKind kind : AuditEventKind.values()) {
      if (kind.category() == AuditEventKind.Category.IDENTITY && !kind.isReserved()) {
        eventSource.subscribe(kind, IdentityAuditEvent.class, this::onIdentityEvent);
        subscribed.add(kind);
      }
    }
    subscribe(
        subscribed,
        AuditEventKind.USERS_SAVED,
        UsersSavedEvent.class,
        formatter::formatUsersSaved);
    subscribe(
        subscribed,
        AuditEventKind.USERS_DELETED,
        UsersDeletedEvent.class,
        formatter::formatUsersDeleted);
    subscribe(
        subscribed,
        AuditEventKind.USER_GROUPS_SAVED,
        UserGroupsSavedEvent.class,
        formatter::formatUserGroupsSaved);
    subscribe(
        subscribed,
        AuditEventKind.USER_GROUP_PERMISSIONS_ASSIGNED,
        UserGroupPermissionsAssignedEvent.class,
        formatter::formatPermissionsAssigned);
    subscribe(
        subscribed,
        AuditEventKind.MEMBERS_SAVED,
        MembersSavedEvent.class,
        formatter::formatMembersSaved);
    subscribe(
        subscribed,
        AuditEventKind.MEMBERS_DELETED,
        MembersDeletedEvent.class,
        formatter::formatMembersDeleted);
    subscribe(
        subscribed,
        AuditEventKind.MEMBER_ROLES_ASSIGNED,
        MemberRolesAssignedEvent.class,
        formatter::formatRolesAssigned);
    subscribe(
        subscribed,
        AuditEventKind.MEMBER_ROLES_REMOVED,
        MemberRolesRemovedEvent.class,
        formatter::formatRolesRemoved);
    subscriptions = Collections.unmodifiableList(subscribed);
    log.info("Audit event router registered for {} event kinds", subscribed.size());
  }

  public RouterState state() {
    return state.get();
  }

  public boolean isRegistered() {
    return state.get() == RouterState.REGISTERED;
  }

  /** Kinds this router has subscribed to; empty until registered. */
  public List<AuditEventKind> subscriptions() {
    return subscriptions;
  }

  void onIdentityEvent(IdentityAuditEvent event) {
    var kind = event.kind();
    if (kind.skipsUnattributed() && event.performingUserId() < 0) {
      log.debug(
          "Skipping {} without an attributable performer (performingUserId={})",
          kind,
          event.performingUserId());
      return;
    }
    dispatch(
        event,
        () -> {
          ActorContext actor =
              contextResolver.resolveActor(event.performingUserId(), event.ipAddress());
          UserProfile affected =
              kind.targetsUser() ? contextResolver.requireUser(event.affectedUserId()) : null;
          return List.of(formatter.formatIdentityEvent(event, actor, affected));
        });
  }

  private <E extends AuditableEvent> void subscribe(
      List<AuditEventKind> subscribed,
      AuditEventKind kind,
      Class<E> payloadType,
      BiFunction<E, ActorContext, List<AuditEntry>> format) {
    eventSource.subscribe(
        kind,
        payloadType,
        event -> dispatch(event, () -> format.apply(event, contextResolver.resolveCurrentActor())));
    subscribed.add(kind);
  }

  /** Formats all entries first, so a consistency failure never leaves a partial set appended. */
  private void dispatch(AuditableEvent event, Supplier<List<AuditEntry>> entries) {
    MDC.put(MDC_EVENT_KIND, event.kind().name());
    try {
      var formatted = entries.get();
      for (AuditEntry entry : formatted) {
        sink.append(entry);
      }
      log.debug("Recorded {} audit entries for {}", formatted.size(), event.kind());
    } catch (AuditConsistencyException | AuditSinkException e) {
      log.warn("Failed to audit {} event: {}", event.kind(), e.getMessage());
      throw e;
    } finally {
      MDC.remove(MDC_EVENT_KIND);
    }
  }
}
