package io.b2mash.b2b.backofficeaudit.directory;

import java.util.Optional;

/** Read access to back-office users. Implemented by the user administration service. */
public interface UserDirectory {

  Optional<UserProfile> findById(int userId);
}
