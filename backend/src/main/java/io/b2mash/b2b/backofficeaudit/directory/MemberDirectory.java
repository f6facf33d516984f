package io.b2mash.b2b.backofficeaudit.directory;

import java.util.Collection;
import java.util.Map;

/** Read access to site members. Implemented by the membership service. */
public interface MemberDirectory {

  /**
   * Loads all members with the given ids in a single round trip. Ids without a member are absent
   * from the result.
   */
  Map<Integer, MemberProfile> findAllByIds(Collection<Integer> memberIds);
}
