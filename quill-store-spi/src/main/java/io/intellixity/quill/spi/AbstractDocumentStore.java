package io.intellixity.quill.spi;

import io.intellixity.quill.query.QueryDescriptor;
import io.intellixity.quill.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Template for {@link DocumentStore} backends.
 *
 * Responsibilities:
 * - argument checks and execution-time query checks (a limit must be positive)
 * - debug logging of every operation with its duration
 * - converting backend runtime failures into {@link StoreException}
 *
 * Backends implement the {@code do*} hooks and only see validated arguments.
 */
public abstract class AbstractDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(AbstractDocumentStore.class);

  private final String id;

  protected AbstractDocumentStore(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  /** Store id used in log lines. */
  public String id() { return id; }

  @Override
  public final String newDocumentId(CollectionPath collection) {
    Objects.requireNonNull(collection, "collection");
    return run("newDocumentId", collection, () -> doNewDocumentId(collection));
  }

  @Override
  public final List<DocumentSnapshot> find(QueryDescriptor query) {
    checkQuery(query);
    return run("find", query.collection(), () -> doFind(query));
  }

  @Override
  public final long count(QueryDescriptor query) {
    checkQuery(query);
    return run("count", query.collection(), () -> doCount(query));
  }

  @Override
  public final DocumentSnapshot get(DocumentRef ref) {
    Objects.requireNonNull(ref, "ref");
    return run("get", ref.collection(), () -> doGet(ref));
  }

  @Override
  public final void set(DocumentRef ref, Map<String, Object> data, boolean merge) {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(data, "data");
    run(merge ? "set_merge" : "set", ref.collection(), () -> {
      doSet(ref, data, merge);
      return null;
    });
  }

  @Override
  public final void update(DocumentRef ref, Map<String, Object> fields) {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) throw new StoreException("Update of " + ref + " has no fields");
    run("update", ref.collection(), () -> {
      doUpdate(ref, fields);
      return null;
    });
  }

  @Override
  public final void delete(DocumentRef ref) {
    Objects.requireNonNull(ref, "ref");
    run("delete", ref.collection(), () -> {
      doDelete(ref);
      return null;
    });
  }

  /** Random 20 character id. Backends with native id generation override this. */
  protected String doNewDocumentId(CollectionPath collection) {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 20);
  }

  protected abstract List<DocumentSnapshot> doFind(QueryDescriptor query);

  protected abstract long doCount(QueryDescriptor query);

  protected abstract DocumentSnapshot doGet(DocumentRef ref);

  protected abstract void doSet(DocumentRef ref, Map<String, Object> data, boolean merge);

  /** Must throw {@link StoreException} when the document does not exist. */
  protected abstract void doUpdate(DocumentRef ref, Map<String, Object> fields);

  protected abstract void doDelete(DocumentRef ref);

  private static void checkQuery(QueryDescriptor query) {
    Objects.requireNonNull(query, "query");
    Integer limit = query.limit();
    if (limit != null && limit < 1) {
      throw new StoreException("Query limit must be positive: " + limit);
    }
  }

  private <R> R run(String op, CollectionPath collection, Supplier<R> work) {
    long start = System.nanoTime();
    try {
      R result = work.get();
      if (log.isDebugEnabled()) {
        log.debug("quill.store op={} store={} collection={} durationMs={} result={}",
            op, id, collection, (System.nanoTime() - start) / 1_000_000.0, safeResult(result));
      }
      return result;
    } catch (StoreException e) {
      throw e;
    } catch (RuntimeException e) {
      log.debug("quill.store_failed op={} store={} collection={}", op, id, collection, e);
      throw new StoreException(op + " on " + collection + " failed: " + e.getMessage(), e);
    }
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof List<?> l) return "size=" + l.size();
    if (r instanceof DocumentSnapshot s) return s.exists() ? "exists" : "missing";
    return r.getClass().getSimpleName();
  }
}
