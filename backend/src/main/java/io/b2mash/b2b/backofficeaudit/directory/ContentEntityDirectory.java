package io.b2mash.b2b.backofficeaudit.directory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read access to content tree entities (documents, media) that permissions are assigned on. */
public interface ContentEntityDirectory {

  /** Loads all entities with the given ids in a single round trip. Unknown ids are absent. */
  Map<Integer, ContentEntitySummary> findAllByIds(Collection<Integer> entityIds);

  default Optional<ContentEntitySummary> findById(int entityId) {
    return Optional.ofNullable(findAllByIds(List.of(entityId)).get(entityId));
  }
}
