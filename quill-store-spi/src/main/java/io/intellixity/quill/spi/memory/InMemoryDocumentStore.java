package io.intellixity.quill.spi.memory;

import io.intellixity.quill.query.Condition;
import io.intellixity.quill.query.QueryDescriptor;
import io.intellixity.quill.query.SortField;
import io.intellixity.quill.spi.AbstractDocumentStore;
import io.intellixity.quill.store.DocumentRef;
import io.intellixity.quill.store.DocumentSnapshot;
import io.intellixity.quill.store.StoreException;

import java.util.*;

/**
 * Simple in-memory document store.
 *
 * Useful for tests, demos and local development. Documents are kept per collection path ordered by id;
 * data is deep-copied on the way in and out. All operations are serialized on the store instance.
 */
public final class InMemoryDocumentStore extends AbstractDocumentStore {
  private final Map<String, NavigableMap<String, Map<String, Object>>> collections = new HashMap<>();

  public InMemoryDocumentStore() {
    this("memory");
  }

  public InMemoryDocumentStore(String id) {
    super(id);
  }

  @Override
  protected synchronized List<DocumentSnapshot> doFind(QueryDescriptor query) {
    NavigableMap<String, Map<String, Object>> docs = collections.get(query.collection().path());
    if (docs == null) return List.of();

    List<Map.Entry<String, Map<String, Object>>> hits = new ArrayList<>();
    for (var e : docs.entrySet()) {
      if (matchesAll(e.getValue(), query)) hits.add(e);
    }
    if (!query.sort().isEmpty()) hits.sort(order(query.sort()));

    Integer limit = query.limit();
    int n = (limit == null) ? hits.size() : Math.min(limit, hits.size());
    List<DocumentSnapshot> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      var e = hits.get(i);
      out.add(DocumentSnapshot.of(query.collection().document(e.getKey()), DocumentValues.deepCopyMap(e.getValue())));
    }
    return out;
  }

  @Override
  protected long doCount(QueryDescriptor query) {
    return doFind(query).size();
  }

  @Override
  protected synchronized DocumentSnapshot doGet(DocumentRef ref) {
    NavigableMap<String, Map<String, Object>> docs = collections.get(ref.collection().path());
    Map<String, Object> data = (docs == null) ? null : docs.get(ref.id());
    return (data == null) ? DocumentSnapshot.missing(ref) : DocumentSnapshot.of(ref, DocumentValues.deepCopyMap(data));
  }

  @Override
  protected synchronized void doSet(DocumentRef ref, Map<String, Object> data, boolean merge) {
    NavigableMap<String, Map<String, Object>> docs =
        collections.computeIfAbsent(ref.collection().path(), k -> new TreeMap<>());
    Map<String, Object> existing = docs.get(ref.id());
    if (merge && existing != null) {
      DocumentValues.deepMerge(existing, data);
    } else {
      docs.put(ref.id(), DocumentValues.deepCopyMap(data));
    }
  }

  @Override
  protected synchronized void doUpdate(DocumentRef ref, Map<String, Object> fields) {
    NavigableMap<String, Map<String, Object>> docs = collections.get(ref.collection().path());
    Map<String, Object> existing = (docs == null) ? null : docs.get(ref.id());
    if (existing == null) throw new StoreException("No document to update: " + ref);
    for (var e : fields.entrySet()) DocumentValues.setByPath(existing, e.getKey(), e.getValue());
  }

  @Override
  protected synchronized void doDelete(DocumentRef ref) {
    NavigableMap<String, Map<String, Object>> docs = collections.get(ref.collection().path());
    if (docs != null) docs.remove(ref.id());
  }

  /** Number of documents directly in the collection at {@code collectionPath}. */
  public synchronized int size(String collectionPath) {
    NavigableMap<String, Map<String, Object>> docs = collections.get(collectionPath);
    return (docs == null) ? 0 : docs.size();
  }

  public synchronized void clear() {
    collections.clear();
  }

  private static boolean matchesAll(Map<String, Object> data, QueryDescriptor query) {
    for (Condition c : query.conditions()) {
      if (!DocumentValues.matches(data, c)) return false;
    }
    // documents without a sort field are not part of an ordered result
    for (SortField s : query.sort()) {
      if (DocumentValues.getByPath(data, s.field()) == DocumentValues.MISSING) return false;
    }
    return true;
  }

  private static Comparator<Map.Entry<String, Map<String, Object>>> order(List<SortField> sort) {
    return (a, b) -> {
      for (SortField s : sort) {
        int c = DocumentValues.compare(
            DocumentValues.getByPath(a.getValue(), s.field()),
            DocumentValues.getByPath(b.getValue(), s.field()));
        if (c != 0) return s.apply(c);
      }
      return a.getKey().compareTo(b.getKey());
    };
  }
}
