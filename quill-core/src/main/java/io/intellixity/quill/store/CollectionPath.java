package io.intellixity.quill.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Address of a collection: a top-level collection id, or a collection id under a parent document.
 *
 * @param parent parent document, null for top-level collections
 * @param id collection id (single segment)
 */
public record CollectionPath(DocumentRef parent, String id) {
  public CollectionPath {
    id = Paths.requireSegment(id, "collection id");
  }

  public static CollectionPath of(String id) {
    return new CollectionPath(null, id);
  }

  /** Parses {@code "users"} or {@code "users/u1/messages"}. */
  public static CollectionPath parse(String path) {
    List<String> segments = Paths.split(path);
    if (segments.size() % 2 == 0) {
      throw new IllegalArgumentException("Not a collection path (even number of segments): " + path);
    }
    CollectionPath cur = of(segments.get(0));
    for (int i = 1; i < segments.size(); i += 2) {
      cur = cur.document(segments.get(i)).collection(segments.get(i + 1));
    }
    return cur;
  }

  public boolean isSubcollection() { return parent != null; }

  public DocumentRef document(String documentId) {
    return new DocumentRef(this, documentId);
  }

  /** Collection ids from the root, without document ids: {@code users/u1/messages -> [users, messages]}. */
  public List<String> collectionIds() {
    List<String> out = new ArrayList<>();
    for (CollectionPath c = this; c != null; c = (c.parent == null) ? null : c.parent.collection()) {
      out.add(c.id);
    }
    Collections.reverse(out);
    return out;
  }

  public String path() {
    return (parent == null) ? id : parent.path() + "/" + id;
  }

  @Override
  public String toString() {
    return path();
  }
}
