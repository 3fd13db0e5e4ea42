package io.intellixity.quill.store;

/** Failure reported by a {@link DocumentStore} backend. */
public class StoreException extends RuntimeException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
