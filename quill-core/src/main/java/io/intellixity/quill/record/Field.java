package io.intellixity.quill.record;

import java.util.List;
import java.util.Objects;

/**
 * Typed reference to one property of a record type.
 *
 * <p>Fields are declared once as constants next to the record and registered on its {@link RecordType}:
 * <pre>{@code
 * public static final Field<Item, Integer> PRICE = Field.of("price", Integer.class);
 * public static final Field<Item, List<String>> TAGS = Field.list("tags", String.class);
 * }</pre>
 *
 * The path is the in-memory property path (dot separated for nested objects). Whether it is also the
 * stored name is decided by the {@link io.intellixity.quill.compile.FieldResolver}. Two fields are equal
 * only if they are the same constant.
 *
 * @param <T> record type owning the property
 * @param <V> value type of the property
 */
public final class Field<T, V> {
  private final String path;
  private final Class<?> valueType;
  private final Class<?> elementType;

  private Field(String path, Class<?> valueType, Class<?> elementType) {
    this.path = requirePath(path);
    this.valueType = Objects.requireNonNull(valueType, "valueType");
    this.elementType = elementType;
  }

  public static <T, V> Field<T, V> of(String path, Class<V> valueType) {
    return new Field<>(path, valueType, null);
  }

  /** A list-valued property; the element type is used to validate updates. */
  public static <T, E> Field<T, List<E>> list(String path, Class<E> elementType) {
    return new Field<>(path, List.class, Objects.requireNonNull(elementType, "elementType"));
  }

  public String path() { return path; }
  public Class<?> valueType() { return valueType; }

  /** Element type for list fields, null otherwise. */
  public Class<?> elementType() { return elementType; }

  public boolean isList() { return elementType != null; }

  @Override
  public String toString() {
    return "Field(" + path + ": " + valueType.getSimpleName() + (elementType == null ? "" : "<" + elementType.getSimpleName() + ">") + ")";
  }

  private static String requirePath(String path) {
    if (path == null || path.isBlank()) throw new IllegalArgumentException("field path is required");
    for (String segment : path.split("\\.", -1)) {
      if (segment.isBlank()) throw new IllegalArgumentException("Invalid field path: '" + path + "'");
    }
    return path;
  }
}
