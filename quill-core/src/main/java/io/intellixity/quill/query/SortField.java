package io.intellixity.quill.query;

import java.util.Objects;

/** One ordering key of a query, by stored field name. */
public record SortField(String field, boolean descending) {
  public SortField {
    Objects.requireNonNull(field, "field");
  }

  public static SortField asc(String field) { return new SortField(field, false); }
  public static SortField desc(String field) { return new SortField(field, true); }

  /** Turns an ascending comparison of two field values into one for this key's direction. */
  public int apply(int ascendingComparison) {
    return descending ? -ascendingComparison : ascendingComparison;
  }

  /** {@code 1} or {@code -1}, the usual index-style direction marker. */
  public int sign() { return descending ? -1 : 1; }

  @Override
  public String toString() {
    return field + (descending ? " desc" : " asc");
  }
}
