package io.intellixity.quill.record;

/**
 * Per-type override of stored field names, for records whose stored names differ from their property names.
 *
 * <p>Return the stored name for fields you remap and null for everything else; unmapped fields fall
 * through to the structural default.
 */
@FunctionalInterface
public interface FieldNaming<T> {
  String storedName(Field<T, ?> field);
}
