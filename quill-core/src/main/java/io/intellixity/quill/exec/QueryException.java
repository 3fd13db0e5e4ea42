package io.intellixity.quill.exec;

import io.intellixity.quill.store.DocumentRef;

import java.util.Objects;

/**
 * Failure of a terminal query or write operation.
 * <p>
 * {@link Kind#NOT_FOUND} is only raised by id lookups; every other failure (backend, permissions,
 * encoding/decoding, malformed queries rejected by the store) is {@link Kind#STORE_ERROR}.
 */
public final class QueryException extends RuntimeException {
  public enum Kind { NOT_FOUND, STORE_ERROR }

  private final Kind kind;

  private QueryException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public static QueryException notFound(DocumentRef ref) {
    return new QueryException(Kind.NOT_FOUND, "Document '" + ref.id() + "' not found in collection '" + ref.collection() + "'", null);
  }

  public static QueryException storeError(String message, Throwable cause) {
    return new QueryException(Kind.STORE_ERROR, message, cause);
  }

  public Kind kind() { return kind; }

  public boolean isNotFound() { return kind == Kind.NOT_FOUND; }
}
