package io.intellixity.nativa.docstore.crypto;

import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.json.JsonCodec;
import io.intellixity.nativa.docstore.model.StorageRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts document records to and from their stored JSON shape.
 * <p>
 * Stored shapes:
 * <ul>
 *   <li>plain: {@code {id, payload}}</li>
 *   <li>whole payload: {@code {id, [collection,] encrypted_payload}}</li>
 *   <li>field level: {@code {id, collection, payload, encrypted_fields: {field: cipher(json(value))}}}</li>
 * </ul>
 * Without a cipher both directions are the plain shape.
 */
public final class RecordEncryption {
  public static final String ID = "id";
  public static final String COLLECTION = "collection";
  public static final String PAYLOAD = "payload";
  public static final String ENCRYPTED_PAYLOAD = "encrypted_payload";
  public static final String ENCRYPTED_FIELDS = "encrypted_fields";

  private static final RecordEncryption DISABLED = new RecordEncryption(null);

  private final RecordCipher cipher;

  public RecordEncryption(RecordCipher cipher) {
    this.cipher = cipher;
  }

  public static RecordEncryption disabled() { return DISABLED; }

  public boolean enabled() { return cipher != null; }

  /**
   * Stored form of {@code record}.
   *
   * @param collection written next to the ciphertext when non-null
   * @param encryptedFields empty means whole-payload encryption
   */
  public Map<String, Object> encrypt(StorageRecord record, String collection, Collection<String> encryptedFields) {
    if (cipher == null) return plain(record);

    Map<String, Object> out = new LinkedHashMap<>();
    out.put(ID, record.id());
    if (encryptedFields == null || encryptedFields.isEmpty()) {
      if (collection != null) out.put(COLLECTION, collection);
      out.put(ENCRYPTED_PAYLOAD, apply(JsonCodec.write(record.payload()), true));
      return out;
    }

    Map<String, Object> rest = new LinkedHashMap<>(record.payload());
    Map<String, Object> sealed = new LinkedHashMap<>();
    for (String field : encryptedFields) {
      if (!rest.containsKey(field)) continue;
      sealed.put(field, apply(JsonCodec.write(rest.remove(field)), true));
    }
    out.put(COLLECTION, collection);
    out.put(PAYLOAD, rest);
    out.put(ENCRYPTED_FIELDS, sealed);
    return out;
  }

  /** Inverse of {@link #encrypt}. Stored documents without ciphertext pass through. */
  @SuppressWarnings("unchecked")
  public StorageRecord decrypt(Map<String, Object> stored) {
    String id = String.valueOf(stored.get(ID));
    Object payload = stored.get(PAYLOAD);
    Map<String, Object> base = (payload instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    if (cipher == null) return new StorageRecord(id, base);

    Object whole = stored.get(ENCRYPTED_PAYLOAD);
    if (whole != null) {
      Object decoded = decode(apply(String.valueOf(whole), false));
      if (!(decoded instanceof Map<?, ?> m)) {
        throw StorageException.encryption("Decrypted payload of " + id + " is not a JSON object", null);
      }
      return new StorageRecord(id, (Map<String, Object>) m);
    }

    Object fields = stored.get(ENCRYPTED_FIELDS);
    if (fields instanceof Map<?, ?> sealed) {
      Map<String, Object> merged = new LinkedHashMap<>(base);
      for (var e : sealed.entrySet()) {
        merged.put(String.valueOf(e.getKey()), decode(apply(String.valueOf(e.getValue()), false)));
      }
      return new StorageRecord(id, merged);
    }
    return new StorageRecord(id, base);
  }

  /** {@code true} when the stored document carries ciphertext of either shape. */
  public static boolean isEncrypted(Map<String, Object> stored) {
    return stored.get(ENCRYPTED_PAYLOAD) != null || stored.get(ENCRYPTED_FIELDS) != null;
  }

  private static Map<String, Object> plain(StorageRecord record) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(ID, record.id());
    out.put(PAYLOAD, record.payload());
    return out;
  }

  private String apply(String text, boolean encrypt) {
    String result;
    try {
      result = encrypt ? cipher.encrypt(text) : cipher.decrypt(text);
    } catch (RuntimeException e) {
      throw StorageException.wrap(e, ErrorKind.ENCRYPTION_ERROR, encrypt ? "Encryption failed" : "Decryption failed");
    }
    if (result == null) throw StorageException.encryption("Cipher returned null", null);
    return result;
  }

  private static Object decode(String json) {
    try {
      return JsonCodec.readValue(json);
    } catch (Exception e) {
      throw StorageException.encryption("Decrypted value is not valid JSON", e);
    }
  }
}
