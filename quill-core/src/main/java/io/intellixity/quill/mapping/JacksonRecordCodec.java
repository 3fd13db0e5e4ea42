package io.intellixity.quill.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.quill.record.RecordType;
import io.intellixity.quill.store.DocumentSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RecordCodec} backed by a Jackson {@link ObjectMapper} tree conversion (no JSON text in between).
 * <p>
 * The default mapper ignores unknown document fields, so stores may carry extra fields a record does not
 * declare. It also leaves null record properties out of the document, so a merge write only touches the
 * properties the record actually carries.
 */
public final class JacksonRecordCodec implements RecordCodec {
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonRecordCodec() {
    this(defaultMapper());
  }

  public JacksonRecordCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  @Override
  public <T> Map<String, Object> encode(RecordType<T> type, T record) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(record, "record");
    Map<String, Object> data;
    try {
      data = mapper.convertValue(record, MAP);
    } catch (IllegalArgumentException e) {
      throw new RecordCodecException("Failed to encode " + type.recordClass().getName() + ": " + e.getMessage(), e);
    }
    if (data == null) data = new LinkedHashMap<>();
    if (type.idProperty() != null) data.remove(type.idProperty());
    return data;
  }

  @Override
  public Object encodeValue(Object value) {
    if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) return value;
    try {
      return mapper.convertValue(value, Object.class);
    } catch (IllegalArgumentException e) {
      throw new RecordCodecException("Failed to encode value of " + value.getClass().getName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public <T> T decode(RecordType<T> type, DocumentSnapshot snapshot) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(snapshot, "snapshot");
    if (!snapshot.exists()) {
      throw new IllegalArgumentException("Cannot decode missing document " + snapshot.ref());
    }
    Map<String, Object> data = new LinkedHashMap<>(snapshot.data());
    if (type.idProperty() != null) data.put(type.idProperty(), snapshot.id());
    try {
      return mapper.convertValue(data, type.recordClass());
    } catch (IllegalArgumentException e) {
      throw new RecordCodecException("Failed to decode " + snapshot.ref() + " as "
          + type.recordClass().getName() + ": " + e.getMessage(), e);
    }
  }
}
