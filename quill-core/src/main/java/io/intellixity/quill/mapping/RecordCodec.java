package io.intellixity.quill.mapping;

import io.intellixity.quill.record.RecordType;
import io.intellixity.quill.store.DocumentSnapshot;

import java.util.Map;

/** Converts between records and the plain-map document representation exchanged with stores. */
public interface RecordCodec {
  /** Document data for the record, without the record's id property. */
  <T> Map<String, Object> encode(RecordType<T> type, T record);

  /**
   * Stored form of a single field value, as it would appear inside an encoded document. Used for filter
   * operands and update values so they compare equal to what {@link #encode} wrote.
   */
  Object encodeValue(Object value);

  /** Record built from an existing document; the document id is placed in the type's id property. */
  <T> T decode(RecordType<T> type, DocumentSnapshot snapshot);
}
