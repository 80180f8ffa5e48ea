package io.intellixity.nativa.docstore.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson mapper for stored documents.
 * <p>
 * Integral numbers decode as {@code Integer}/{@code Long}, floating point as {@code Double}; objects decode to
 * insertion-ordered maps.
 */
public final class JsonCodec {
  private static final ObjectMapper JSON = new ObjectMapper()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  private JsonCodec() {}

  public static ObjectMapper mapper() { return JSON; }

  public static String write(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StorageException(ErrorKind.MALFORMED_INPUT, "Value is not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }

  /** Parse a JSON object; {@code null} text yields {@code null}. Non-object JSON is rejected. */
  public static Map<String, Object> readMap(String text) {
    if (text == null) return null;
    try {
      return JSON.readValue(text, MAP);
    } catch (JsonProcessingException e) {
      throw StorageException.io("Stored data is not a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  /** Parse any JSON value (object, array, scalar). */
  public static Object readValue(String text) throws JsonProcessingException {
    return JSON.readValue(text, Object.class);
  }
}
