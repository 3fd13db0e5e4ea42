package io.intellixity.quill.query;

public enum Operator {
  EQ("=="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),

  IN("in"),

  // Value is a single element the array field must contain.
  ARRAY_CONTAINS("array-contains"),
  // Value is a list; the array field must contain at least one of them.
  ARRAY_CONTAINS_ANY("array-contains-any");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isComparison() {
    return this == LT || this == LE || this == GT || this == GE;
  }

  /** True if the value is a list of candidates rather than a single operand. */
  public boolean takesList() {
    return this == IN || this == ARRAY_CONTAINS_ANY;
  }
}
