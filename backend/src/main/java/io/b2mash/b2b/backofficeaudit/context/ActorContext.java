package io.b2mash.b2b.backofficeaudit.context;

import io.b2mash.b2b.backofficeaudit.directory.UserProfile;
import java.util.Objects;

/**
 * Who performed an audited action and where from. Resolved once per event and passed explicitly to
 * every formatting call.
 *
 * @param userId actor id; {@code 0} for the system pseudo-identity, never negative
 * @param name actor display name
 * @param email actor email; empty when unknown
 * @param ipAddress caller address; empty when unknown
 */
public record ActorContext(int userId, String name, String email, String ipAddress) {

  public static final int SYSTEM_USER_ID = 0;
  public static final String SYSTEM_USER_NAME = "SYSTEM";

  public ActorContext {
    if (userId < 0) {
      throw new IllegalArgumentException("Actor id must not be negative, was " + userId);
    }
    Objects.requireNonNull(name, "name");
    email = email == null ? "" : email;
    ipAddress = ipAddress == null ? "" : ipAddress;
  }

  public static ActorContext system(String ipAddress) {
    return new ActorContext(SYSTEM_USER_ID, SYSTEM_USER_NAME, "", ipAddress);
  }

  public static ActorContext of(UserProfile user, String ipAddress) {
    return new ActorContext(
        user.id(), user.name() == null ? "" : user.name(), user.email(), ipAddress);
  }

  public boolean isSystem() {
    return userId == SYSTEM_USER_ID && SYSTEM_USER_NAME.equals(name);
  }
}
