package io.intellixity.quill.compile;

import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;

import java.util.Objects;
import java.util.Optional;

/**
 * Default resolver: a type's own override (table entry, then naming function) wins; otherwise a field
 * registered on the type resolves to its declared path; anything else is unresolvable.
 */
final class RegisteredFieldResolver implements FieldResolver {
  static final RegisteredFieldResolver INSTANCE = new RegisteredFieldResolver();

  private RegisteredFieldResolver() {}

  @Override
  public <T> Optional<String> resolve(RecordType<T> type, Field<T, ?> field) {
    Objects.requireNonNull(type, "type");
    if (field == null) return Optional.empty();

    String overridden = type.overriddenName(field);
    if (overridden != null) return Optional.of(overridden);

    return type.isRegistered(field) ? Optional.of(field.path()) : Optional.empty();
  }
}
