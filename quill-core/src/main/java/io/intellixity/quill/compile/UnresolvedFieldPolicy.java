package io.intellixity.quill.compile;

/** What a query builder does when a filter or sort field has no stored name. */
public enum UnresolvedFieldPolicy {
  /** Log a warning and leave the query unchanged. */
  SKIP,
  /** Throw {@link io.intellixity.quill.query.QueryValidationException} while the query is being built. */
  FAIL
}
