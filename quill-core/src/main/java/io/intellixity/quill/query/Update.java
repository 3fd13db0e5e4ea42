package io.intellixity.quill.query;

import io.intellixity.quill.compile.FieldResolver;
import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;

import java.util.*;

/**
 * Typed partial update for one record type.
 *
 * <pre>{@code
 * Update<Item> u = Update.of(Item.TYPE)
 *     .set(Item.PRICE, 12)
 *     .set(Item.TAGS, List.of("sale"));
 * }</pre>
 *
 * Instances are immutable; setting the same field twice keeps the last value.
 */
public final class Update<T> {
  private final RecordType<T> type;
  private final List<FieldUpdate<T>> updates;

  private Update(RecordType<T> type, List<FieldUpdate<T>> updates) {
    this.type = Objects.requireNonNull(type, "type");
    this.updates = updates;
  }

  public static <T> Update<T> of(RecordType<T> type) {
    return new Update<>(type, List.of());
  }

  public <V> Update<T> set(Field<T, V> field, V value) {
    List<FieldUpdate<T>> next = new ArrayList<>(updates);
    next.add(new FieldUpdate<>(Objects.requireNonNull(field, "field"), value));
    return new Update<>(type, Collections.unmodifiableList(next));
  }

  public RecordType<T> type() { return type; }
  public List<FieldUpdate<T>> updates() { return updates; }
  public boolean isEmpty() { return updates.isEmpty(); }

  /**
   * Validates every entry against the record type and returns stored field name to value.
   *
   * @throws QueryValidationException if the update is empty, a field has no stored name, or a value does
   *     not fit the field's declared type
   */
  public Map<String, Object> toStoredFields(FieldResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    if (updates.isEmpty()) throw new QueryValidationException("Update for " + type + " has no fields");

    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldUpdate<T> u : updates) {
      String name = resolver.resolve(type, u.field())
          .orElseThrow(() -> new QueryValidationException("No stored field name for " + u.field() + " on " + type));
      checkValue(u.field(), u.value());
      out.put(name, u.value());
    }
    return out;
  }

  private void checkValue(Field<T, ?> field, Object value) {
    if (value == null) return;
    if (!field.valueType().isInstance(value)) {
      throw new QueryValidationException("Value of type " + value.getClass().getName()
          + " does not fit " + field + " on " + type);
    }
    if (field.isList()) {
      for (Object e : (Collection<?>) value) {
        if (e != null && !field.elementType().isInstance(e)) {
          throw new QueryValidationException("List element of type " + e.getClass().getName()
              + " does not fit " + field + " on " + type);
        }
      }
    }
  }

  public record FieldUpdate<T>(Field<T, ?> field, Object value) {}
}
