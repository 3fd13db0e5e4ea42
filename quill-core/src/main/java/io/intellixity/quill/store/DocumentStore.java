package io.intellixity.quill.store;

import io.intellixity.quill.query.QueryDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Backend contract used by query builders. Implementations own all I/O, consistency and the native document
 * representation; every operation is a single attempt and reports failures as {@link StoreException}.
 * <p>
 * Document data is exchanged as plain maps whose values are strings, numbers, booleans, dates, lists and
 * nested maps.
 */
public interface DocumentStore {
  /** Fresh id for a new document in the collection. Does not write anything. */
  String newDocumentId(CollectionPath collection);

  /** Documents matching the descriptor, in explicit sort order or the store's default order. */
  List<DocumentSnapshot> find(QueryDescriptor query);

  /** Number of documents {@link #find} would return. */
  long count(QueryDescriptor query);

  /** Snapshot of one document; {@link DocumentSnapshot#exists()} is false when it is missing. */
  DocumentSnapshot get(DocumentRef ref);

  /**
   * Creates or overwrites a document. With {@code merge}, fields absent from {@code data} are kept and nested
   * maps are merged; otherwise the document is replaced.
   */
  void set(DocumentRef ref, Map<String, Object> data, boolean merge);

  /**
   * Updates the given fields of an existing document. Keys may be dot paths into nested maps.
   * Fails if the document does not exist.
   */
  void update(DocumentRef ref, Map<String, Object> fields);

  /** Removes a document. Deleting a missing document is not an error unless the backend says so. */
  void delete(DocumentRef ref);
}
