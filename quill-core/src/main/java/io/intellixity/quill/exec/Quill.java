package io.intellixity.quill.exec;

import io.intellixity.quill.compile.FieldResolver;
import io.intellixity.quill.compile.UnresolvedFieldPolicy;
import io.intellixity.quill.mapping.JacksonRecordCodec;
import io.intellixity.quill.mapping.RecordCodec;
import io.intellixity.quill.record.RecordLoader;
import io.intellixity.quill.record.RecordType;
import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;
import io.intellixity.quill.store.DocumentStore;

import java.util.Objects;

/**
 * Entry point: binds a document store, a codec and field resolution settings, and hands out query builders.
 *
 * <pre>{@code
 * Quill quill = Quill.builder(store)
 *     .unresolvedFieldPolicy(UnresolvedFieldPolicy.FAIL)
 *     .build();
 *
 * List<Item> cheap = quill.query(Item.TYPE)
 *     .whereLessThan(Item.PRICE, 10)
 *     .orderBy(Item.PRICE)
 *     .all();
 * }</pre>
 *
 * Instances are immutable and safe to share.
 */
public final class Quill {
  private final DocumentStore store;
  private final RecordCodec codec;
  private final FieldResolver fieldResolver;
  private final UnresolvedFieldPolicy unresolvedFieldPolicy;

  private Quill(Builder b) {
    this.store = b.store;
    this.codec = b.codec;
    this.fieldResolver = b.fieldResolver;
    this.unresolvedFieldPolicy = b.unresolvedFieldPolicy;
  }

  public static Quill of(DocumentStore store) {
    return builder(store).build();
  }

  public static Builder builder(DocumentStore store) {
    return new Builder(store);
  }

  public DocumentStore store() { return store; }
  public RecordCodec codec() { return codec; }
  public FieldResolver fieldResolver() { return fieldResolver; }
  public UnresolvedFieldPolicy unresolvedFieldPolicy() { return unresolvedFieldPolicy; }

  /** Query over the type's top-level collection. */
  public <T> QueryBuilder<T> query(RecordType<T> type) {
    Objects.requireNonNull(type, "type");
    return new QueryBuilder<>(this, type, CollectionPath.of(type.collectionName()));
  }

  /** Query over the type's collection nested under {@code parent}. */
  public <T> QueryBuilder<T> query(RecordType<T> type, DocumentRef parent) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(parent, "parent");
    return new QueryBuilder<>(this, type, parent.collection(type.collectionName()));
  }

  /**
   * Builds a record from a document handle, using the type's {@link RecordLoader} when it has one and
   * fetch-and-decode otherwise.
   *
   * @throws QueryException {@code NOT_FOUND} if the default loader finds no document
   */
  public <T> T load(RecordType<T> type, DocumentRef ref) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(ref, "ref");
    RecordLoader<T> loader = type.loader();
    if (loader != null) return loader.load(this, ref);
    return new QueryBuilder<>(this, type, ref.collection()).getByDocumentId(ref.id());
  }

  public static final class Builder {
    private final DocumentStore store;
    private RecordCodec codec = new JacksonRecordCodec();
    private FieldResolver fieldResolver = FieldResolver.registered();
    private UnresolvedFieldPolicy unresolvedFieldPolicy = UnresolvedFieldPolicy.SKIP;

    private Builder(DocumentStore store) {
      this.store = Objects.requireNonNull(store, "store");
    }

    public Builder codec(RecordCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    public Builder fieldResolver(FieldResolver fieldResolver) {
      this.fieldResolver = Objects.requireNonNull(fieldResolver, "fieldResolver");
      return this;
    }

    public Builder unresolvedFieldPolicy(UnresolvedFieldPolicy policy) {
      this.unresolvedFieldPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    public Quill build() {
      return new Quill(this);
    }
  }
}
