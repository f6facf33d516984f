package io.b2mash.b2b.backofficeaudit.context;

import io.b2mash.b2b.backofficeaudit.exception.AuditConsistencyException;
import java.util.Optional;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Reads the current principal from Spring Security. The authentication name is expected to be the
 * numeric back-office user id.
 */
@Component
public class SecurityContextIdentitySource implements IdentitySource {

  @Override
  public Optional<CurrentIdentity> currentPrincipal() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
      return Optional.empty();
    }
    try {
      return Optional.of(new CurrentIdentity(Integer.parseInt(auth.getName())));
    } catch (NumberFormatException e) {
      throw new AuditConsistencyException(
          "Authenticated principal '" + auth.getName() + "' is not a back-office user id");
    }
  }
}
