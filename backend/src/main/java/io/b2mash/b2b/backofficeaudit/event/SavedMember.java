package io.b2mash.b2b.backofficeaudit.event;

import java.util.List;

public record SavedMember(int id, String name, String email, List<String> changedFields) {

  public SavedMember {
    changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
  }
}
