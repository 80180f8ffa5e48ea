package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.crypto.RecordEncryption;
import io.intellixity.nativa.docstore.model.CollectionConfig;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Construction inputs shared by every layout strategy. */
public record LayoutOptions(
    RecordEncryption encryption,
    Map<String, CollectionConfig> collections,
    Logger log,
    boolean transactionsDisabled
) {
  public LayoutOptions {
    encryption = (encryption == null) ? RecordEncryption.disabled() : encryption;
    collections = (collections == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(collections));
    log = (log == null) ? NOPLogger.NOP_LOGGER : log;
  }

  public static LayoutOptions defaults() {
    return new LayoutOptions(null, null, null, false);
  }

  public CollectionConfig config(String collection) {
    CollectionConfig c = (collection == null) ? null : collections.get(collection);
    return (c == null) ? CollectionConfig.EMPTY : c;
  }
}
