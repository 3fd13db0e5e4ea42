package io.intellixity.quill.query;

import java.util.*;

/** One resolved predicate: stored field name, operator and operand. */
public record Condition(String field, Operator operator, Object value) {
  public Condition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    if (operator.isComparison() && value == null) {
      throw new IllegalArgumentException(operator + " requires a non-null value");
    }
    if (operator.takesList()) value = listOf(operator, value);
  }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator, value);
  }

  /** Operand as a list, for {@link Operator#takesList()} operators. */
  @SuppressWarnings("unchecked")
  public List<Object> values() {
    if (!operator.takesList()) throw new IllegalStateException(operator + " takes a single value");
    return (List<Object>) value;
  }

  @Override
  public String toString() {
    return field + " " + operator.symbol() + " " + value;
  }

  private static List<Object> listOf(Operator op, Object v) {
    if (v == null) throw new IllegalArgumentException(op + " requires a list of values");
    if (v instanceof Collection<?> c) return Collections.unmodifiableList(new ArrayList<>(c));
    if (v instanceof Object[] a) return Collections.unmodifiableList(Arrays.asList(a.clone()));
    throw new IllegalArgumentException(op + " requires a list of values but got: " + v.getClass().getName());
  }
}
