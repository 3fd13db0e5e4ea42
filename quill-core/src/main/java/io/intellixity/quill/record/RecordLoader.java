package io.intellixity.quill.record;

import io.intellixity.quill.exec.Quill;
import io.intellixity.quill.store.DocumentRef;

/** Builds a record from a document handle. The default fetches the document and decodes it. */
@FunctionalInterface
public interface RecordLoader<T> {
  T load(Quill quill, DocumentRef ref);
}
