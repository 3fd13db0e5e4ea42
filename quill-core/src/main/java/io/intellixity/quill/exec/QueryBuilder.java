package io.intellixity.quill.exec;

import io.intellixity.quill.compile.UnresolvedFieldPolicy;
import io.intellixity.quill.query.*;
import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;
import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;
import io.intellixity.quill.store.DocumentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Fluent, typed query over one collection of one record type.
 *
 * <p>Builders are immutable: every filter, sort or limit call returns a new builder whose descriptor has one
 * more element, and leaves the receiver untouched. Terminal operations ({@link #all()}, {@link #first()},
 * {@link #count()}, {@link #getByDocumentId(String)} and the writes) run against the store of the
 * {@link Quill} that created the builder.
 *
 * <p>A field without a stored name is handled according to {@link Quill#unresolvedFieldPolicy()}: with
 * {@link UnresolvedFieldPolicy#SKIP} the call logs a warning and returns this builder unchanged, with
 * {@link UnresolvedFieldPolicy#FAIL} it throws {@link QueryValidationException}.
 */
public final class QueryBuilder<T> {
  private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

  private final Quill quill;
  private final RecordType<T> type;
  private final QueryDescriptor descriptor;

  QueryBuilder(Quill quill, RecordType<T> type, CollectionPath collection) {
    this(quill, type, QueryDescriptor.of(collection));
  }

  private QueryBuilder(Quill quill, RecordType<T> type, QueryDescriptor descriptor) {
    this.quill = Objects.requireNonNull(quill, "quill");
    this.type = Objects.requireNonNull(type, "type");
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }

  public RecordType<T> type() { return type; }
  public CollectionPath collection() { return descriptor.collection(); }
  public QueryDescriptor descriptor() { return descriptor; }

  // ---------- filters ----------

  public <V> QueryBuilder<T> whereEqualTo(Field<T, V> field, V value) {
    return where(field, Operator.EQ, value);
  }

  public <V extends Comparable<? super V>> QueryBuilder<T> whereLessThan(Field<T, V> field, V value) {
    return where(field, Operator.LT, value);
  }

  public <V extends Comparable<? super V>> QueryBuilder<T> whereLessThanOrEqualTo(Field<T, V> field, V value) {
    return where(field, Operator.LE, value);
  }

  public <V extends Comparable<? super V>> QueryBuilder<T> whereGreaterThan(Field<T, V> field, V value) {
    return where(field, Operator.GT, value);
  }

  public <V extends Comparable<? super V>> QueryBuilder<T> whereGreaterThanOrEqualTo(Field<T, V> field, V value) {
    return where(field, Operator.GE, value);
  }

  /** Array field contains {@code value}. */
  public <E> QueryBuilder<T> whereArrayContains(Field<T, ? extends Collection<E>> field, E value) {
    return where(field, Operator.ARRAY_CONTAINS, value);
  }

  /** Array field contains at least one of {@code values}. */
  public <E> QueryBuilder<T> whereArrayContainsAny(Field<T, ? extends Collection<E>> field, Collection<? extends E> values) {
    return where(field, Operator.ARRAY_CONTAINS_ANY, Objects.requireNonNull(values, "values"));
  }

  /** Field equals one of {@code values}. */
  public <V> QueryBuilder<T> whereIn(Field<T, V> field, Collection<? extends V> values) {
    return where(field, Operator.IN, Objects.requireNonNull(values, "values"));
  }

  // ---------- ordering / limit ----------

  public QueryBuilder<T> orderBy(Field<T, ? extends Comparable<?>> field) {
    return orderBy(field, false);
  }

  public QueryBuilder<T> orderBy(Field<T, ? extends Comparable<?>> field, boolean descending) {
    String name = resolveOrSkip(field, "order by");
    if (name == null) return this;
    return with(descriptor.withSort(new SortField(name, descending)));
  }

  /** Caps the number of results; a later call replaces an earlier one. Range is checked by the store. */
  public QueryBuilder<T> limit(int limit) {
    return with(descriptor.withLimit(limit));
  }

  // ---------- fetch ----------

  public List<T> all() {
    QueryDescriptor q = descriptor;
    return execute("all", () -> {
      List<DocumentSnapshot> docs = quill.store().find(q);
      List<T> out = new ArrayList<>(docs.size());
      for (DocumentSnapshot d : docs) out.add(quill.codec().decode(type, d));
      return out;
    });
  }

  /** First match, or empty when nothing matches. */
  public Optional<T> first() {
    List<T> rows = limit(1).all();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public long count() {
    QueryDescriptor q = descriptor;
    return execute("count", () -> quill.store().count(q));
  }

  /**
   * Looks up one document of the bound collection by id. Filters, sort and limit of this builder are ignored.
   *
   * @throws QueryException {@code NOT_FOUND} if there is no such document, {@code STORE_ERROR} otherwise
   */
  public T getByDocumentId(String documentId) {
    DocumentRef ref = collection().document(documentId);
    return execute("getByDocumentId", () -> {
      DocumentSnapshot snapshot = quill.store().get(ref);
      if (snapshot == null || !snapshot.exists()) {
        log.info("Document '{}' not found in collection '{}'", ref.id(), ref.collection());
        throw QueryException.notFound(ref);
      }
      return quill.codec().decode(type, snapshot);
    });
  }

  // ---------- writes ----------

  /** Writes the record under a store-generated id, replacing nothing. */
  public DocumentRef set(T record) {
    return set(record, null, false);
  }

  public DocumentRef set(T record, String documentId) {
    return set(record, documentId, false);
  }

  /**
   * Creates or overwrites a document of the bound collection.
   *
   * @param documentId target id, or null for a store-generated one
   * @param merge keep fields not present in the record instead of replacing the whole document
   * @return reference to the written document
   */
  public DocumentRef set(T record, String documentId, boolean merge) {
    Objects.requireNonNull(record, "record");
    DocumentRef explicit = (documentId == null) ? null : collection().document(documentId);
    return execute("set", () -> write(explicit, quill.codec().encode(type, record), merge));
  }

  /** Untyped variant of {@link #set(Object, String, boolean)}; keys are stored field names. */
  public DocumentRef set(Map<String, Object> data, String documentId, boolean merge) {
    Objects.requireNonNull(data, "data");
    DocumentRef explicit = (documentId == null) ? null : collection().document(documentId);
    Map<String, Object> copy = new LinkedHashMap<>(data);
    return execute("set", () -> write(explicit, copy, merge));
  }

  /**
   * Applies a typed partial update to an existing document. The update is validated before anything is sent.
   *
   * @throws QueryValidationException if the update does not fit this record type
   * @throws QueryException {@code STORE_ERROR} on store failures, including a missing document
   */
  public void update(Update<T> update, String documentId) {
    Objects.requireNonNull(update, "update");
    if (update.type() != type) {
      throw new QueryValidationException("Update for " + update.type() + " cannot be applied to " + type);
    }
    Map<String, Object> fields = update.toStoredFields(quill.fieldResolver());
    fields.replaceAll((name, value) -> quill.codec().encodeValue(value));
    DocumentRef ref = collection().document(documentId);
    execute("update", () -> {
      quill.store().update(ref, fields);
      return null;
    });
  }

  public void delete(String documentId) {
    DocumentRef ref = collection().document(documentId);
    execute("delete", () -> {
      quill.store().delete(ref);
      return null;
    });
  }

  // ---------- internals ----------

  private QueryBuilder<T> where(Field<T, ?> field, Operator op, Object value) {
    String name = resolveOrSkip(field, "filter " + op.symbol());
    if (name == null) return this;
    return with(descriptor.withCondition(Condition.of(name, op, encodeOperand(op, value))));
  }

  private Object encodeOperand(Operator op, Object value) {
    if (op.takesList() && value instanceof Collection<?> values) {
      List<Object> encoded = new ArrayList<>(values.size());
      for (Object v : values) encoded.add(quill.codec().encodeValue(v));
      return encoded;
    }
    return quill.codec().encodeValue(value);
  }

  private String resolveOrSkip(Field<T, ?> field, String what) {
    Objects.requireNonNull(field, "field");
    Optional<String> name = quill.fieldResolver().resolve(type, field);
    if (name.isPresent()) return name.get();

    if (quill.unresolvedFieldPolicy() == UnresolvedFieldPolicy.FAIL) {
      throw new QueryValidationException("No stored field name for " + field + " on " + type);
    }
    log.warn("Could not resolve stored field name for {} on {}. Skipping {}.", field, type, what);
    return null;
  }

  private QueryBuilder<T> with(QueryDescriptor next) {
    return new QueryBuilder<>(quill, type, next);
  }

  private DocumentRef write(DocumentRef explicit, Map<String, Object> data, boolean merge) {
    DocumentRef ref = (explicit != null) ? explicit : collection().document(quill.store().newDocumentId(collection()));
    quill.store().set(ref, data, merge);
    return ref;
  }

  private <R> R execute(String op, Supplier<R> work) {
    try {
      return work.get();
    } catch (QueryException e) {
      throw e;
    } catch (RuntimeException e) {
      log.debug("quill.query op={} collection={} failed", op, collection(), e);
      String message = (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
      throw QueryException.storeError(message, e);
    }
  }
}
