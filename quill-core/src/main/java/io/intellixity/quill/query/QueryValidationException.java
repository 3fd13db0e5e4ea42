package io.intellixity.quill.query;

/**
 * Raised while a query or update is being built, when it references unresolvable fields or carries values
 * that do not fit the record type.
 * <p>
 * Never raised by terminal operations for store-side failures; those surface as
 * {@link io.intellixity.quill.exec.QueryException}.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
