package io.b2mash.b2b.backofficeaudit.directory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read access to back-office user groups. */
public interface UserGroupDirectory {

  /** Loads all groups with the given ids in a single round trip. Unknown ids are absent. */
  Map<Integer, UserGroupProfile> findAllByIds(Collection<Integer> groupIds);

  default Optional<UserGroupProfile> findById(int groupId) {
    return Optional.ofNullable(findAllByIds(List.of(groupId)).get(groupId));
  }
}
