package io.intellixity.nativa.docstore.layout.shared;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.Row;
import io.intellixity.nativa.docstore.json.JsonCodec;
import io.intellixity.nativa.docstore.layout.AbstractLayoutStrategy;
import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.model.*;

import java.util.*;

/**
 * All documents in one {@code docs} table, metadata and the JSON inventory in {@code meta}.
 * <p>
 * Encryption, when enabled, is whole-payload only; per-collection encrypted-field lists are ignored.
 */
public final class SharedTableStrategy extends AbstractLayoutStrategy {
  public static final String ID = "shared-table";
  public static final String DOCS_TABLE = "docs";
  public static final String META_TABLE = "meta";

  public SharedTableStrategy() {
    this(LayoutOptions.defaults());
  }

  public SharedTableStrategy(LayoutOptions options) {
    super(options);
  }

  @Override public String id() { return ID; }

  @Override public InventoryRepresentation inventoryRepresentation() { return InventoryRepresentation.JSON; }

  @Override
  public void initializeSchema(DatabaseOperations db) {
    ddl(db, "CREATE TABLE IF NOT EXISTS docs (id TEXT PRIMARY KEY, data JSON)");
    ddl(db, "CREATE TABLE IF NOT EXISTS meta (id TEXT PRIMARY KEY, data JSON)");
    log.debug("SharedTableStrategy: schema initialized");
  }

  @Override
  public boolean validateSchema(DatabaseOperations db) {
    return tableExists(db, DOCS_TABLE) && tableExists(db, META_TABLE);
  }

  @Override
  public String tableNameFor(String collection) {
    return (META_COLLECTION.equals(collection) || INVENTORY_COLLECTION.equals(collection)) ? META_TABLE : DOCS_TABLE;
  }

  @Override
  public void writeRecords(DatabaseOperations db, RecordBatch batch) {
    Objects.requireNonNull(batch, "batch");
    if (batch.isEmpty()) return;
    requireCollections(batch);

    inWriteTx(db, tx -> {
      if (!batch.docs().isEmpty()) {
        Inventory.Builder inventory = readInventory(tx).toBuilder();
        for (StorageRecord r : batch.docs()) {
          Map<String, Object> stored = encryptRecordForCollection(r, r.collection());
          tx.execute("INSERT OR REPLACE INTO docs (id, data) VALUES (?, ?)", List.of(r.id(), JsonCodec.write(stored)));
          inventory.put(r.collection(), r.id(), r.version());
        }
        writeInventory(tx, inventory.build());
      }
      for (StorageRecord m : batch.meta()) {
        tx.execute("INSERT OR REPLACE INTO meta (id, data) VALUES (?, ?)", List.of(m.id(), JsonCodec.write(m.payload())));
      }
      return null;
    });
    log.debug("SharedTableStrategy: wrote {} record(s)", batch.size());
  }

  @Override
  public StorageRecord readRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    Objects.requireNonNull(id, "id");
    if (kind == RecordKind.META) {
      Row row = db.queryOne("SELECT data FROM meta WHERE id = ?", List.of(id));
      return (row == null) ? null : metaRecord(id, row);
    }
    Row row = db.queryOne("SELECT data FROM docs WHERE id = ?", List.of(id));
    return (row == null) ? null : decryptRecordForCollection(json(row, "data"), collection);
  }

  @Override
  public List<StorageRecord> readAllRecords(DatabaseOperations db, RecordKind kind, String collection) {
    if (kind == RecordKind.META) {
      List<StorageRecord> out = new ArrayList<>();
      for (Row row : db.queryAll("SELECT id, data FROM meta")) out.add(metaRecord(row.string("id"), row));
      return out;
    }
    boolean all = LayoutStrategy.isUnspecified(collection);
    List<StorageRecord> out = new ArrayList<>();
    for (Row row : db.queryAll("SELECT id, data FROM docs")) {
      StorageRecord r = decryptRecordForCollection(json(row, "data"), collection);
      if (all || collection.equals(r.collection())) out.add(r);
    }
    return out;
  }

  @Override
  public List<StorageRecord> readRecordsBulk(DatabaseOperations db, RecordKind kind, String collection, List<String> ids) {
    if (ids == null || ids.isEmpty()) return List.of();
    String table = (kind == RecordKind.META) ? META_TABLE : DOCS_TABLE;
    List<Row> rows = db.queryAll("SELECT id, data FROM " + table + " WHERE id IN (" + placeholders(ids.size()) + ")", ids);

    List<StorageRecord> out = new ArrayList<>(rows.size());
    for (Row row : rows) {
      out.add(kind == RecordKind.META
          ? metaRecord(row.string("id"), row)
          : decryptRecordForCollection(json(row, "data"), collection));
    }
    log.debug("SharedTableStrategy: bulk read {}/{} record(s) from {}", out.size(), ids.size(), table);
    return out;
  }

  @Override
  public void deleteRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    Objects.requireNonNull(id, "id");
    if (kind == RecordKind.META) {
      db.execute("DELETE FROM meta WHERE id = ?", List.of(id));
      return;
    }
    inWriteTx(db, tx -> {
      tx.execute("DELETE FROM docs WHERE id = ?", List.of(id));
      Inventory current = readInventory(tx);
      Inventory.Builder next = current.toBuilder();
      if (LayoutStrategy.isUnspecified(collection)) {
        for (String c : current.collections().keySet()) next.remove(c, id);
      } else {
        next.remove(collection, id);
      }
      Inventory updated = next.build();
      if (!updated.equals(current)) writeInventory(tx, updated);
      return null;
    });
    log.debug("SharedTableStrategy: deleted {} from docs", id);
  }

  @Override
  public void updateInventoryItem(DatabaseOperations db, String collection, String docId, long version,
                                  InventoryOperation op) {
    Objects.requireNonNull(op, "op");
    requireInventoryKey(collection, docId);
    inWriteTx(db, tx -> {
      Inventory.Builder b = readInventory(tx).toBuilder();
      if (op.isUpsert()) b.put(collection, docId, version);
      else b.remove(collection, docId);
      writeInventory(tx, b.build());
      return null;
    });
    log.debug("SharedTableStrategy: inventory {} {}/{}", op, collection, docId);
  }

  @Override
  public Inventory readInventory(DatabaseOperations db) {
    Row row = db.queryOne("SELECT data FROM meta WHERE id = ?", List.of(Inventory.RECORD_ID));
    return (row == null) ? Inventory.empty() : Inventory.fromJsonMap(json(row, "data"));
  }

  @Override
  public Inventory initializeInventory(DatabaseOperations db) {
    return inWriteTx(db, tx -> {
      Row row = tx.queryOne("SELECT data FROM meta WHERE id = ?", List.of(Inventory.RECORD_ID));
      if (row != null) return Inventory.fromJsonMap(json(row, "data"));
      tx.execute("INSERT INTO meta (id, data) VALUES (?, ?)",
          List.of(Inventory.RECORD_ID, JsonCodec.write(Inventory.empty().toJsonMap())));
      return Inventory.empty();
    });
  }

  @Override
  public void deleteAllTables(DatabaseOperations db) {
    db.execute("DROP TABLE IF EXISTS meta");
    db.execute("DROP TABLE IF EXISTS docs");
    log.debug("SharedTableStrategy: deleted all tables");
  }

  @Override
  public CollectionStats collectionStats(DatabaseOperations db, String collection) {
    Map<String, Long> docs = readInventory(db).collections().getOrDefault(collection, Map.of());
    long max = 0;
    for (long v : docs.values()) max = Math.max(max, v);
    return new CollectionStats(collection, docs.size(), max);
  }

  @Override
  public Map<String, Object> encryptRecordForCollection(StorageRecord record, String collection) {
    return encryption.encrypt(record, null, Set.of());
  }

  @Override
  public StorageRecord decryptRecordForCollection(Map<String, Object> stored, String collection) {
    return encryption.decrypt(stored);
  }

  private static void writeInventory(DatabaseOperations tx, Inventory inventory) {
    tx.execute("INSERT OR REPLACE INTO meta (id, data) VALUES (?, ?)",
        List.of(Inventory.RECORD_ID, JsonCodec.write(inventory.toJsonMap())));
  }
}
