package io.intellixity.quill.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Document contents as read from a store. A snapshot of a missing document has no data.
 */
public record DocumentSnapshot(DocumentRef ref, Map<String, Object> data) {
  public DocumentSnapshot {
    Objects.requireNonNull(ref, "ref");
    data = (data == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static DocumentSnapshot of(DocumentRef ref, Map<String, Object> data) {
    return new DocumentSnapshot(ref, Objects.requireNonNull(data, "data"));
  }

  public static DocumentSnapshot missing(DocumentRef ref) {
    return new DocumentSnapshot(ref, null);
  }

  public boolean exists() { return data != null; }

  public String id() { return ref.id(); }
}
