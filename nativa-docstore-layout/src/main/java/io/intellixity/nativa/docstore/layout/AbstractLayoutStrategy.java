package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.crypto.RecordEncryption;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.Row;
import io.intellixity.nativa.docstore.json.JsonCodec;
import io.intellixity.nativa.docstore.model.RecordBatch;
import io.intellixity.nativa.docstore.model.StorageRecord;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Plumbing shared by the SQLite layout strategies: transaction scoping, input checks, JSON rows and DDL error
 * mapping. Subclasses own every statement.
 */
public abstract class AbstractLayoutStrategy implements LayoutStrategy, BulkReadSupport {
  protected final LayoutOptions options;
  protected final RecordEncryption encryption;
  protected final Logger log;

  protected AbstractLayoutStrategy(LayoutOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.encryption = options.encryption();
    this.log = options.log();
  }

  public LayoutOptions options() { return options; }

  /** Run {@code body} in one transaction, or directly when transactions were disabled at construction. */
  protected <T> T inWriteTx(DatabaseOperations db, Function<DatabaseOperations, T> body) {
    Objects.requireNonNull(db, "db");
    if (options.transactionsDisabled()) return body.apply(db);
    return db.transaction(body);
  }

  /** Reject the whole batch up front if any document lacks its collection tag. */
  protected static void requireCollections(RecordBatch batch) {
    for (StorageRecord r : batch.docs()) requireCollection(r);
  }

  protected static String requireCollection(StorageRecord r) {
    String c = r.collection();
    if (c == null) {
      throw StorageException.malformed("Record " + r.id() + " is missing required collection field in payload");
    }
    return c;
  }

  protected static void requireInventoryKey(String collection, String docId) {
    if (collection == null || collection.isBlank()) throw StorageException.malformed("Inventory collection is required");
    if (docId == null || docId.isBlank()) throw StorageException.malformed("Inventory docId is required");
  }

  protected static Map<String, Object> json(Row row, String column) {
    Map<String, Object> m = JsonCodec.readMap(row.string(column));
    return (m == null) ? Collections.emptyMap() : m;
  }

  /** Meta rows store the bare payload. */
  protected static StorageRecord metaRecord(String id, Row row) {
    return new StorageRecord(id, json(row, "data"));
  }

  protected static String placeholders(int n) {
    return String.join(", ", Collections.nCopies(n, "?"));
  }

  protected static boolean tableExists(DatabaseOperations db, String table) {
    return db.queryOne("SELECT name FROM sqlite_master WHERE type = 'table' AND lower(name) = lower(?)", List.of(table)) != null;
  }

  /** Run a DDL statement, reporting any failure as a schema error. */
  protected static void ddl(DatabaseOperations db, String sql) {
    try {
      db.execute(sql);
    } catch (StorageException e) {
      throw StorageException.schema("DDL failed [" + sql + "]: " + e.getMessage(), e);
    }
  }

  protected static String quote(String table) {
    return "\"" + table + "\"";
  }
}
