package io.intellixity.quill.store;

import java.util.List;
import java.util.Objects;

/**
 * Address of one document.
 *
 * @param collection containing collection
 * @param id document id (single segment)
 */
public record DocumentRef(CollectionPath collection, String id) {
  public DocumentRef {
    Objects.requireNonNull(collection, "collection");
    id = Paths.requireSegment(id, "document id");
  }

  /** Parses {@code "users/u1"} or {@code "users/u1/messages/m1"}. */
  public static DocumentRef parse(String path) {
    List<String> segments = Paths.split(path);
    if (segments.size() % 2 != 0) {
      throw new IllegalArgumentException("Not a document path (odd number of segments): " + path);
    }
    CollectionPath c = CollectionPath.parse(String.join("/", segments.subList(0, segments.size() - 1)));
    return c.document(segments.get(segments.size() - 1));
  }

  /** Subcollection under this document. */
  public CollectionPath collection(String collectionId) {
    return new CollectionPath(this, collectionId);
  }

  public String path() {
    return collection.path() + "/" + id;
  }

  @Override
  public String toString() {
    return path();
  }
}
