package io.intellixity.nativa.docstore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The persisted unit: an id plus a JSON-compatible payload.
 * <p>
 * Document ids are conventionally {@code "<collection>/<docId>"}; document payloads carry their
 * {@code collection} and optionally a numeric version under {@code v}.
 */
public record StorageRecord(String id, Map<String, Object> payload) {
  public static final String COLLECTION_FIELD = "collection";
  public static final String VERSION_FIELD = "v";
  public static final long DEFAULT_VERSION = 1L;

  public StorageRecord {
    Objects.requireNonNull(id, "id");
    payload = (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /** Collection tag inside the payload, or {@code null} when absent or not a non-blank string. */
  public String collection() {
    Object c = payload.get(COLLECTION_FIELD);
    return (c instanceof String s && !s.isBlank()) ? s : null;
  }

  /** Version from the payload's {@code v} field, {@link #DEFAULT_VERSION} when missing or not numeric. */
  public long version() {
    Object v = payload.get(VERSION_FIELD);
    if (v instanceof Number n && n.longValue() != 0) return n.longValue();
    return DEFAULT_VERSION;
  }
}
