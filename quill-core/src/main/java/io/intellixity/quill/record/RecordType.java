package io.intellixity.quill.record;

import java.util.*;

/**
 * Describes how one record class maps to a document collection.
 *
 * <p>A record type is declared once, typically as a constant on the record:
 * <pre>{@code
 * public static final RecordType<Item> TYPE = RecordType.builder(Item.class, "items")
 *     .idProperty("id")
 *     .fields(NAME, PRICE, TAGS)
 *     .storedName(PRICE, "unit_price")
 *     .build();
 * }</pre>
 *
 * The collection name is a single collection id ("messages"), never a path; subcollections are addressed
 * by passing the parent document when creating a query.
 */
public final class RecordType<T> {
  private final Class<T> recordClass;
  private final String collectionName;
  private final Set<Field<T, ?>> fields;
  private final Map<Field<T, ?>, String> storedNames;
  private final FieldNaming<T> naming;
  private final String idProperty;
  private final RecordLoader<T> loader;

  private RecordType(Builder<T> b) {
    this.recordClass = b.recordClass;
    this.collectionName = b.collectionName;
    this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(b.fields));
    this.storedNames = Collections.unmodifiableMap(new LinkedHashMap<>(b.storedNames));
    this.naming = b.naming;
    this.idProperty = b.idProperty;
    this.loader = b.loader;
  }

  public static <T> Builder<T> builder(Class<T> recordClass, String collectionName) {
    return new Builder<>(recordClass, collectionName);
  }

  public Class<T> recordClass() { return recordClass; }
  public String collectionName() { return collectionName; }
  public Set<Field<T, ?>> fields() { return fields; }
  public boolean isRegistered(Field<T, ?> field) { return fields.contains(field); }

  /** Record property receiving the document id on decode; null when the record does not carry its id. */
  public String idProperty() { return idProperty; }

  /** Custom loader, or null to use fetch-and-decode. */
  public RecordLoader<T> loader() { return loader; }

  /**
   * Stored name override for the field, or null when the type does not remap it.
   * Table entries win over the naming function.
   */
  public String overriddenName(Field<T, ?> field) {
    String explicit = storedNames.get(field);
    if (explicit != null) return explicit;
    if (naming == null) return null;
    String n = naming.storedName(field);
    return (n == null || n.isBlank()) ? null : n;
  }

  @Override
  public String toString() {
    return "RecordType(" + recordClass.getSimpleName() + " -> " + collectionName + ")";
  }

  public static final class Builder<T> {
    private final Class<T> recordClass;
    private final String collectionName;
    private final List<Field<T, ?>> fields = new ArrayList<>();
    private final Map<Field<T, ?>, String> storedNames = new LinkedHashMap<>();
    private FieldNaming<T> naming;
    private String idProperty;
    private RecordLoader<T> loader;

    private Builder(Class<T> recordClass, String collectionName) {
      this.recordClass = Objects.requireNonNull(recordClass, "recordClass");
      if (collectionName == null || collectionName.isBlank()) throw new IllegalArgumentException("collectionName is required");
      if (collectionName.contains("/")) {
        throw new IllegalArgumentException("collectionName must be a collection id, not a path: " + collectionName);
      }
      this.collectionName = collectionName;
    }

    public Builder<T> field(Field<T, ?> field) {
      fields.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    @SafeVarargs
    public final Builder<T> fields(Field<T, ?>... fields) {
      for (Field<T, ?> f : fields) field(f);
      return this;
    }

    /** Registers the field (if needed) and maps it to a different stored name. */
    public Builder<T> storedName(Field<T, ?> field, String storedName) {
      if (storedName == null || storedName.isBlank()) throw new IllegalArgumentException("storedName is required");
      if (!fields.contains(field)) field(field);
      storedNames.put(field, storedName);
      return this;
    }

    public Builder<T> naming(FieldNaming<T> naming) { this.naming = naming; return this; }

    public Builder<T> idProperty(String idProperty) {
      if (idProperty != null && idProperty.isBlank()) throw new IllegalArgumentException("idProperty must not be blank");
      this.idProperty = idProperty;
      return this;
    }

    public Builder<T> loader(RecordLoader<T> loader) { this.loader = loader; return this; }

    public RecordType<T> build() {
      return new RecordType<>(this);
    }
  }
}
