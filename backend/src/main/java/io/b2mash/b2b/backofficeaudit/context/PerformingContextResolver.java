package io.b2mash.b2b.backofficeaudit.context;

import io.b2mash.b2b.backofficeaudit.directory.UserDirectory;
import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import io.b2mash.b2b.backofficeaudit.exception.AuditConsistencyException;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Resolves the acting identity and caller address attributed to an audited action.
 *
 * <p>Without an authenticated principal the actor is the system pseudo-identity (id 0, name
 * "SYSTEM"). A principal that does not resolve to a user is a consistency failure between the
 * identity layer and the user store and raises {@link AuditConsistencyException}.
 */
@Service
public class PerformingContextResolver {

  private static final String UNKNOWN_ADDRESS_PREFIX = "unknown";

  private final IdentitySource identitySource;
  private final CallerAddressSource callerAddressSource;
  private final UserDirectory userDirectory;

  public PerformingContextResolver(
      IdentitySource identitySource,
      CallerAddressSource callerAddressSource,
      UserDirectory userDirectory) {
    this.identitySource = identitySource;
    this.callerAddressSource = callerAddressSource;
    this.userDirectory = userDirectory;
  }

  /** The acting user of the current operation, or the system pseudo-identity. */
  public UserProfile resolveActor() {
    return identitySource
        .currentPrincipal()
        .map(identity -> requireUser(identity.userId()))
        .orElseGet(
            () -> new UserProfile(ActorContext.SYSTEM_USER_ID, ActorContext.SYSTEM_USER_NAME, ""));
  }

  /**
   * Caller address of the current request. Transport layers that report {@code unknown...} instead
   * of an address yield an empty string.
   */
  public String resolveCallerAddress() {
    return normalizeAddress(callerAddressSource.currentRequestIpAddress());
  }

  /** Actor and caller address of the current operation in one value. */
  public ActorContext resolveCurrentActor() {
    UserProfile actor = resolveActor();
    return new ActorContext(actor.id(), actor.name(), actor.email(), resolveCallerAddress());
  }

  /**
   * Actor named by an event payload rather than by the ambient identity. The address is used
   * verbatim.
   */
  public ActorContext resolveActor(int performingUserId, String ipAddress) {
    return ActorContext.of(requireUser(performingUserId), ipAddress);
  }

  public UserProfile requireUser(int userId) {
    return userDirectory
        .findById(userId)
        .orElseThrow(() -> AuditConsistencyException.missing("user", userId));
  }

  static String normalizeAddress(String address) {
    if (address == null || address.toLowerCase(Locale.ROOT).startsWith(UNKNOWN_ADDRESS_PREFIX)) {
      return "";
    }
    return address;
  }
}
