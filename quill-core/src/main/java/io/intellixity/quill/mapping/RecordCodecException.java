package io.intellixity.quill.mapping;

public final class RecordCodecException extends RuntimeException {
  public RecordCodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
