package io.b2mash.b2b.backofficeaudit.context;

import java.util.Optional;

public interface IdentitySource {

  /** The authenticated principal of the current operation, or empty when there is none. */
  Optional<CurrentIdentity> currentPrincipal();
}
