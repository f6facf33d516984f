package io.b2mash.b2b.backofficeaudit.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.backofficeaudit.audit.AuditEntry;
import io.b2mash.b2b.backofficeaudit.audit.AuditSink;
import io.b2mash.b2b.backofficeaudit.audit.AuditSinkException;
import io.b2mash.b2b.backofficeaudit.audit.AuditTrailProperties;
import io.b2mash.b2b.backofficeaudit.context.CallerAddressSource;
import io.b2mash.b2b.backofficeaudit.context.CurrentIdentity;
import io.b2mash.b2b.backofficeaudit.context.IdentitySource;
import io.b2mash.b2b.backofficeaudit.context.PerformingContextResolver;
import io.b2mash.b2b.backofficeaudit.directory.ContentEntityDirectory;
import io.b2mash.b2b.backofficeaudit.directory.MemberDirectory;
import io.b2mash.b2b.backofficeaudit.directory.MemberProfile;
import io.b2mash.b2b.backofficeaudit.directory.UserDirectory;
import io.b2mash.b2b.backofficeaudit.directory.UserGroupDirectory;
import io.b2mash.b2b.backofficeaudit.directory.UserGroupProfile;
import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import io.b2mash.b2b.backofficeaudit.event.ApplicationAuditEventSource;
import io.b2mash.b2b.backofficeaudit.event.AuditEventKind;
import io.b2mash.b2b.backofficeaudit.event.EntityPermission;
import io.b2mash.b2b.backofficeaudit.event.IdentityAuditEvent;
import io.b2mash.b2b.backofficeaudit.event.MemberRolesAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.SavedUser;
import io.b2mash.b2b.backofficeaudit.event.UserGroupPermissionsAssignedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersDeletedEvent;
import io.b2mash.b2b.backofficeaudit.event.UsersSavedEvent;
import io.b2mash.b2b.backofficeaudit.exception.AuditConsistencyException;
import io.b2mash.b2b.backofficeaudit.formatter.AuditEntryFormatter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

class AuditEventRouterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
  private static final UserProfile ALICE = new UserProfile(7, "Alice", "alice@example.com");
  private static final UserProfile BOB = new UserProfile(9, "Bob", "bob@example.com");

  private IdentitySource identitySource;
  private CallerAddressSource callerAddressSource;
  private UserDirectory userDirectory;
  private MemberDirectory memberDirectory;
  private UserGroupDirectory userGroupDirectory;
  private ContentEntityDirectory contentEntityDirectory;
  private AuditSink sink;
  private ApplicationAuditEventSource eventSource;
  private AuditEventRouter router;

  @BeforeEach
  void setUp() {
    identitySource = mock(IdentitySource.class);
    callerAddressSource = mock(CallerAddressSource.class);
    userDirectory = mock(UserDirectory.class);
    memberDirectory = mock(MemberDirectory.class);
    userGroupDirectory = mock(UserGroupDirectory.class);
    contentEntityDirectory = mock(ContentEntityDirectory.class);
    sink = mock(AuditSink.class);
    eventSource = new ApplicationAuditEventSource();

    when(identitySource.currentPrincipal()).thenReturn(Optional.empty());
    when(callerAddressSource.currentRequestIpAddress()).thenReturn("");
    when(userDirectory.findById(7)).thenReturn(Optional.of(ALICE));
    when(userDirectory.findById(9)).thenReturn(Optional.of(BOB));

    router = newRouter(new AuditTrailProperties(true, false));
  }

  private AuditEventRouter newRouter(AuditTrailProperties properties) {
    var resolver =
        new PerformingContextResolver(identitySource, callerAddressSource, userDirectory);
    var formatter =
        new AuditEntryFormatter(
            Clock.fixed(NOW, ZoneOffset.UTC),
            memberDirectory,
            userGroupDirectory,
            contentEntityDirectory);
    return new AuditEventRouter(eventSource, resolver, formatter, sink, properties);
  }

  private List<AuditEntry> appendedEntries(int expected) {
    var captor = ArgumentCaptor.forClass(AuditEntry.class);
    verify(sink, times(expected)).append(captor.capture());
    return captor.getAllValues();
  }

  @Test
  void startsUnregistered() {
    assertThat(router.state()).isEqualTo(RouterState.UNREGISTERED);
    assertThat(router.subscriptions()).isEmpty();
  }

  @Test
  void registerSubscribesEveryWiredKindButNoReservedKind() {
    router.register();

    assertThat(router.isRegistered()).isTrue();
    assertThat(router.subscriptions())
        .hasSize(15)
        .doesNotContain(
            AuditEventKind.ACCOUNT_LOCKED,
            AuditEventKind.ACCOUNT_UNLOCKED,
            AuditEventKind.LOGIN_REQUIRES_VERIFICATION,
            AuditEventKind.RESET_ACCESS_FAILED_COUNT);
    assertThat(eventSource.subscriberCount(AuditEventKind.ACCOUNT_LOCKED)).isZero();
  }

  @Test
  void repeatedRegistrationDoesNotDoubleSubscribe() {
    router.register();
    router.register();

    assertThat(eventSource.subscriberCount(AuditEventKind.LOGIN_SUCCESS)).isEqualTo(1);
  }

  @Test
  void startupRegistersWhenEnabled() {
    router.afterSingletonsInstantiated();

    assertThat(router.isRegistered()).isTrue();
  }

  @Test
  void startupSkipsRegistrationWhenDisabled() {
    var disabled = newRouter(new AuditTrailProperties(false, false));

    disabled.afterSingletonsInstantiated();

    assertThat(disabled.state()).isEqualTo(RouterState.UNREGISTERED);
    assertThat(eventSource.subscriberCount(AuditEventKind.LOGIN_SUCCESS)).isZero();
  }

  @Test
  void loginSuccessUsesPayloadActorAndAddress() {
    router.register();

    eventSource.raise(IdentityAuditEvent.of(AuditEventKind.LOGIN_SUCCESS, 7, "203.0.113.5"));

    var entry = appendedEntries(1).get(0);
    assertThat(entry.performingUserId()).isEqualTo(7);
    assertThat(entry.performingDetails()).isEqualTo("Alice <alice@example.com>");
    assertThat(entry.performingIp()).isEqualTo("203.0.113.5");
    assertThat(entry.eventTypeTag()).isEqualTo("backoffice/user/sign-in/login");
    verify(callerAddressSource, never()).currentRequestIpAddress();
  }

  @Test
  void loginFailedWithNegativePerformerIsSkipped() {
    router.register();

    eventSource.raise(IdentityAuditEvent.of(AuditEventKind.LOGIN_FAILED, -1, "203.0.113.5"));

    verify(sink, never()).append(any());
    verify(userDirectory, never()).findById(-1);
  }

  @Test
  void passwordChangeWithNegativePerformerIsSkipped() {
    router.register();

    eventSource.raise(
        new IdentityAuditEvent(AuditEventKind.PASSWORD_CHANGED, -1, 9, "203.0.113.5"));

    verify(sink, never()).append(any());
  }

  @Test
  void logoutWithUnknownPerformerIsConsistencyViolation() {
    when(userDirectory.findById(-1)).thenReturn(Optional.empty());
    router.register();

    assertThatThrownBy(
            () -> eventSource.raise(IdentityAuditEvent.of(AuditEventKind.LOGOUT_SUCCESS, -1, "")))
        .isInstanceOf(AuditConsistencyException.class);
    verify(sink, never()).append(any());
  }

  @Test
  void passwordResetOnMissingAffectedUserAbortsEvent() {
    when(userDirectory.findById(404)).thenReturn(Optional.empty());
    router.register();

    assertThatThrownBy(
            () ->
                eventSource.raise(
                    new IdentityAuditEvent(AuditEventKind.PASSWORD_RESET, 7, 404, "")))
        .isInstanceOf(AuditConsistencyException.class)
        .hasMessage("No user found with id 404");
    verify(sink, never()).append(any());
  }

  @Test
  void passwordResetRecordsAffectedUser() {
    router.register();

    eventSource.raise(new IdentityAuditEvent(AuditEventKind.PASSWORD_RESET, 7, 9, "10.0.0.1"));

    var entry = appendedEntries(1).get(0);
    assertThat(entry.affectedId()).isEqualTo(9);
    assertThat(entry.affectedDetails()).isEqualTo("User \"Bob\" <bob@example.com>");
    assertThat(entry.eventTypeTag()).isEqualTo("backoffice/user/password/reset");
  }

  @Test
  void administrationEventWithoutIdentityIsAttributedToSystem() {
    router.register();

    eventSource.raise(new UsersDeletedEvent(List.of(BOB)));

    var entry = appendedEntries(1).get(0);
    assertThat(entry.performingUserId()).isZero();
    assertThat(entry.performingDetails()).startsWith("SYSTEM");
    assertThat(entry.performingIp()).isEmpty();
  }

  @Test
  void administrationEventUsesAuthenticatedActorAndRequestAddress() {
    when(identitySource.currentPrincipal()).thenReturn(Optional.of(new CurrentIdentity(7)));
    when(callerAddressSource.currentRequestIpAddress()).thenReturn("192.168.1.20");
    router.register();

    eventSource.raise(
        new UsersSavedEvent(
            List.of(
                new SavedUser(9, "Bob", "bob@example.com", List.of("email"), List.of()),
                new SavedUser(10, "Carol", "", List.of(), List.of()))));

    var entries = appendedEntries(2);
    assertThat(entries).extracting(AuditEntry::performingUserId).containsOnly(7);
    assertThat(entries).extracting(AuditEntry::performingIp).containsOnly("192.168.1.20");
    assertThat(entries).extracting(AuditEntry::timestamp).containsOnly(NOW);
    assertThat(entries)
        .extracting(AuditEntry::comment)
        .containsExactly("updating email", "updating (nothing)");
    verify(identitySource, times(1)).currentPrincipal();
  }

  @Test
  void roleAssignmentAppendsOneEntryPerMember() {
    when(memberDirectory.findAllByIds(any()))
        .thenReturn(
            Map.of(
                1, new MemberProfile(1, "M1", ""),
                2, new MemberProfile(2, "M2", ""),
                3, new MemberProfile(3, "M3", "")));
    router.register();

    eventSource.raise(new MemberRolesAssignedEvent(List.of(1, 2, 3), List.of("VIP", "Gold")));

    var entries = appendedEntries(3);
    assertThat(entries).extracting(AuditEntry::affectedId).containsExactly(1, 2, 3);
    assertThat(entries)
        .extracting(AuditEntry::comment)
        .containsOnly("roles modified, assigned VIP, Gold");
    verify(memberDirectory, times(1)).findAllByIds(any());
  }

  @Test
  void unresolvablePermissionSubjectAppendsNothing() {
    when(userGroupDirectory.findAllByIds(any()))
        .thenReturn(Map.of(3, new UserGroupProfile(3, "Editors", "editors")));
    when(contentEntityDirectory.findAllByIds(any())).thenReturn(Map.of());
    router.register();

    var event =
        new UserGroupPermissionsAssignedEvent(
            List.of(
                new EntityPermission(3, 10, List.of("C")), new EntityPermission(3, 11, List.of())));

    assertThatThrownBy(() -> eventSource.raise(event))
        .isInstanceOf(AuditConsistencyException.class);
    verify(sink, never()).append(any());
  }

  @Test
  void sinkFailurePropagatesWithoutRetry() {
    doThrow(new AuditSinkException("database unavailable", null)).when(sink).append(any());
    router.register();

    assertThatThrownBy(() -> eventSource.raise(new UsersDeletedEvent(List.of(BOB, ALICE))))
        .isInstanceOf(AuditSinkException.class)
        .hasMessage("database unavailable");
    verify(sink, times(1)).append(any());
  }

  @Test
  void reservedKindIsNotAudited() {
    router.register();

    eventSource.raise(IdentityAuditEvent.of(AuditEventKind.ACCOUNT_LOCKED, 7, ""));

    verify(sink, never()).append(any());
  }

  @Test
  void eventKindIsInMdcDuringAppendOnly() {
    var seen = new ArrayList<String>();
    doAnswer(
            invocation -> {
              seen.add(MDC.get("auditEventKind"));
              return null;
            })
        .when(sink)
        .append(any());
    router.register();

    eventSource.raise(new UsersDeletedEvent(List.of(BOB)));

    assertThat(seen).containsExactly("USERS_DELETED");
    assertThat(MDC.get("auditEventKind")).isNull();
  }
}
