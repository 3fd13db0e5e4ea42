package io.intellixity.quill.compile;

import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;

import java.util.Optional;

/**
 * Maps a typed field reference to the field name used by the document store.
 * <p>
 * An empty result means no stored name can be derived. That is not a failure by itself; the caller decides
 * (see {@link UnresolvedFieldPolicy}).
 */
public interface FieldResolver {
  <T> Optional<String> resolve(RecordType<T> type, Field<T, ?> field);

  /** Overrides first, then the structural path of registered fields. */
  static FieldResolver registered() {
    return RegisteredFieldResolver.INSTANCE;
  }
}
