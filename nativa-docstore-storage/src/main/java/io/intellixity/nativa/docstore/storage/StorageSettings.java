package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.crypto.RecordCipher;
import io.intellixity.nativa.docstore.crypto.RecordEncryption;
import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.layout.LayoutStrategies;
import io.intellixity.nativa.docstore.model.CollectionConfig;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.*;

/**
 * Layout choice and per-collection configuration.
 * <p>
 * Property keys: {@code docstore.layout} (strategy id, default {@value LayoutStrategies#DEFAULT_ID}),
 * {@code docstore.encryption} (boolean), {@code docstore.collections.<name>.indexes} and
 * {@code docstore.collections.<name>.encryptedFields} (comma-separated field paths),
 * {@code docstore.schemaPrefix} (schema of an attached database that qualifies reported table names) and
 * {@code docstore.crossDbQueries} (boolean, default {@code true}).
 */
public record StorageSettings(String layout, boolean encryption, Map<String, CollectionConfig> collections,
                              String schemaPrefix, boolean crossDbQueries) {
  public static final String LAYOUT = "docstore.layout";
  public static final String ENCRYPTION = "docstore.encryption";
  public static final String SCHEMA_PREFIX = "docstore.schemaPrefix";
  public static final String CROSS_DB_QUERIES = "docstore.crossDbQueries";
  public static final String COLLECTIONS_PREFIX = "docstore.collections.";

  public StorageSettings {
    layout = (layout == null || layout.isBlank()) ? LayoutStrategies.DEFAULT_ID : layout.trim();
    collections = (collections == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(collections));
    schemaPrefix = (schemaPrefix == null) ? "" : schemaPrefix.trim();
  }

  public StorageSettings(String layout, boolean encryption, Map<String, CollectionConfig> collections) {
    this(layout, encryption, collections, null, true);
  }

  public static StorageSettings defaults() {
    return new StorageSettings(null, false, null);
  }

  public static StorageSettings fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    Map<String, List<String>> indexes = new TreeMap<>();
    Map<String, List<String>> encrypted = new TreeMap<>();

    for (String key : props.stringPropertyNames()) {
      if (!key.startsWith(COLLECTIONS_PREFIX)) continue;
      String rest = key.substring(COLLECTIONS_PREFIX.length());
      int dot = rest.lastIndexOf('.');
      if (dot <= 0) throw new IllegalArgumentException("Malformed collection property: " + key);
      String name = rest.substring(0, dot);
      switch (rest.substring(dot + 1)) {
        case "indexes" -> indexes.put(name, csv(props.getProperty(key)));
        case "encryptedFields" -> encrypted.put(name, csv(props.getProperty(key)));
        default -> throw new IllegalArgumentException("Unknown collection property: " + key);
      }
    }

    Set<String> names = new TreeSet<>(indexes.keySet());
    names.addAll(encrypted.keySet());
    Map<String, CollectionConfig> collections = new LinkedHashMap<>();
    for (String name : names) {
      collections.put(name, new CollectionConfig(
          new LinkedHashSet<>(indexes.getOrDefault(name, List.of())),
          new LinkedHashSet<>(encrypted.getOrDefault(name, List.of()))));
    }
    return new StorageSettings(props.getProperty(LAYOUT), Boolean.parseBoolean(props.getProperty(ENCRYPTION, "false").trim()),
        collections, props.getProperty(SCHEMA_PREFIX),
        Boolean.parseBoolean(props.getProperty(CROSS_DB_QUERIES, "true").trim()));
  }

  /**
   * Strategy construction inputs. Encryption is active only when enabled here and a cipher is supplied.
   */
  public LayoutOptions layoutOptions(RecordCipher cipher, Logger log) {
    Logger l = (log == null) ? NOPLogger.NOP_LOGGER : log;
    RecordEncryption enc = RecordEncryption.disabled();
    if (encryption && cipher != null) {
      enc = new RecordEncryption(cipher);
    } else if (encryption) {
      l.warn("Encryption is enabled but no cipher was supplied; records are stored in plain text");
    }
    return new LayoutOptions(enc, collections, l, false);
  }

  private static List<String> csv(String v) {
    if (v == null || v.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String s : v.split(",")) {
      String t = s.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }
}
