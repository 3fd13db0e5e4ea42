package io.intellixity.quill.mongo;

import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;

/**
 * Maps document paths onto Mongo collections.
 * <p>
 * All documents of a collection group share one Mongo collection named by the collection ids joined with
 * dots ({@code users/u1/messages -> users.messages}). Top-level documents use their id as {@code _id};
 * nested documents use their full path and carry the parent document path in {@code _parent}.
 */
final class MongoPaths {
  static final String ID = "_id";
  static final String PARENT = "_parent";

  private MongoPaths() {}

  static String collectionName(CollectionPath collection) {
    return String.join(".", collection.collectionIds());
  }

  static String documentKey(DocumentRef ref) {
    return ref.collection().isSubcollection() ? ref.path() : ref.id();
  }

  /** Parent document path, or null for a top-level collection. */
  static String parentKey(CollectionPath collection) {
    return collection.isSubcollection() ? collection.parent().path() : null;
  }

  static DocumentRef refOf(CollectionPath collection, Object key) {
    String k = String.valueOf(key);
    if (!collection.isSubcollection()) return collection.document(k);
    String prefix = collection.path() + "/";
    if (!k.startsWith(prefix)) {
      throw new IllegalStateException("Document key '" + k + "' is not under " + collection);
    }
    return collection.document(k.substring(prefix.length()));
  }
}
