package io.intellixity.nativa.docstore.layout.percollection;

import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.Row;
import io.intellixity.nativa.docstore.json.JsonCodec;
import io.intellixity.nativa.docstore.layout.AbstractLayoutStrategy;
import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.model.*;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * One table per collection plus reserved {@code sharedb_meta} and {@code sharedb_inventory} tables.
 * <p>
 * Collection tables are {@code (id TEXT PRIMARY KEY, collection TEXT, data JSON)} with optional expression
 * indexes on {@code $.payload.<field>}. Tables are created lazily on first write and remembered in a
 * created-table registry; the registry is only a cache, every DDL statement is idempotent.
 * <p>
 * Table names replace every character outside {@code [A-Za-z0-9_]} with {@code _}. A table belongs to the first
 * collection written to it: a write from another collection whose name sanitizes to the same table (SQLite names
 * are case-insensitive) is rejected, as is a write that would land in an existing table of a different shape.
 * Rows still carry their collection and reads filter on it.
 */
public final class TablePerCollectionStrategy extends AbstractLayoutStrategy {
  public static final String ID = "table-per-collection";
  public static final String META_TABLE = "sharedb_meta";
  public static final String INVENTORY_TABLE = "sharedb_inventory";

  static final String COLLECTION_COLUMNS = "(id TEXT PRIMARY KEY, collection TEXT, data JSON)";

  private static final Pattern ILLEGAL_TABLE_CHARS = Pattern.compile("[^A-Za-z0-9_]");
  private static final Pattern FIELD_PATH = Pattern.compile("[A-Za-z0-9_]+(\\.[A-Za-z0-9_]+)*");

  private final Clock clock;
  private final Set<String> createdTables = ConcurrentHashMap.newKeySet();
  /** Lower-cased table name to the collection owning it, for claims that were committed. */
  private final Map<String, String> tableOwners = new ConcurrentHashMap<>();
  private final Map<String, String> configuredOwners;

  public TablePerCollectionStrategy(LayoutOptions options) {
    this(options, Clock.systemUTC());
  }

  public TablePerCollectionStrategy(LayoutOptions options, Clock clock) {
    super(options);
    this.clock = Objects.requireNonNull(clock, "clock");
    Map<String, String> configured = new HashMap<>();
    for (var e : options.collections().entrySet()) {
      String table = docTable(e.getKey());
      String other = configured.putIfAbsent(table.toLowerCase(Locale.ROOT), e.getKey());
      if (other != null) throw collision(e.getKey(), table, other);
      for (String field : e.getValue().indexes()) requireFieldPath(e.getKey(), field);
    }
    this.configuredOwners = Map.copyOf(configured);
  }

  @Override public String id() { return ID; }

  @Override public InventoryRepresentation inventoryRepresentation() { return InventoryRepresentation.TABLE; }

  /** Collections whose table is known to exist. */
  public Set<String> createdTables() { return Collections.unmodifiableSet(createdTables); }

  @Override
  public void initializeSchema(DatabaseOperations db) {
    ddl(db, "CREATE TABLE IF NOT EXISTS sharedb_meta (id TEXT PRIMARY KEY, data JSON)");
    ddl(db, "CREATE TABLE IF NOT EXISTS sharedb_inventory ("
        + "collection TEXT NOT NULL, doc_id TEXT NOT NULL, version INTEGER, updated_at INTEGER, "
        + "PRIMARY KEY (collection, doc_id))");
    ddl(db, "CREATE INDEX IF NOT EXISTS idx_inventory_collection ON sharedb_inventory (collection)");
    ddl(db, "CREATE INDEX IF NOT EXISTS idx_inventory_updated ON sharedb_inventory (updated_at)");

    for (String collection : options.collections().keySet()) ensureTable(db, collection);
    log.debug("TablePerCollectionStrategy: schema initialized ({} configured collection(s))", options.collections().size());
  }

  @Override
  public boolean validateSchema(DatabaseOperations db) {
    return tableExists(db, META_TABLE) && tableExists(db, INVENTORY_TABLE);
  }

  @Override
  public String tableNameFor(String collection) {
    if (collection == null) throw StorageException.malformed("Collection name is required");
    if (META_COLLECTION.equals(collection)) return META_TABLE;
    if (INVENTORY_COLLECTION.equals(collection)) return INVENTORY_TABLE;

    String table = ILLEGAL_TABLE_CHARS.matcher(collection).replaceAll("_");
    String lower = table.toLowerCase(Locale.ROOT);
    if (table.isEmpty() || lower.startsWith("sqlite_")
        || lower.equals(META_TABLE) || lower.equals(INVENTORY_TABLE)) {
      throw StorageException.malformed("Collection name '" + collection + "' maps to reserved table name '" + table + "'");
    }
    return table;
  }

  /** Create the collection's table and indexes unless already registered. */
  public void ensureTable(DatabaseOperations db, String collection) {
    if (createdTables.contains(collection)) return;
    Map<String, String> claims = new HashMap<>();
    createCollectionTable(db, collection, claimTable(db, collection, claims));
    tableOwners.putAll(claims);
    createdTables.add(collection);
  }

  @Override
  public void writeRecords(DatabaseOperations db, RecordBatch batch) {
    Objects.requireNonNull(batch, "batch");
    if (batch.isEmpty()) return;
    requireCollections(batch);

    Set<String> created = new LinkedHashSet<>();
    Map<String, String> claims = new HashMap<>();
    inWriteTx(db, tx -> {
      long now = clock.millis();
      for (StorageRecord r : batch.docs()) {
        String collection = r.collection();
        String table = claimTable(tx, collection, claims);
        if (!createdTables.contains(collection) && created.add(collection)) createCollectionTable(tx, collection, table);

        Map<String, Object> stored = encryptRecordForCollection(r, collection);
        tx.execute("INSERT OR REPLACE INTO " + quote(table) + " (id, collection, data) VALUES (?, ?, ?)",
            List.of(r.id(), collection, JsonCodec.write(stored)));
        upsertInventory(tx, collection, r.id(), r.version(), now);
      }
      for (StorageRecord m : batch.meta()) {
        tx.execute("INSERT OR REPLACE INTO sharedb_meta (id, data) VALUES (?, ?)",
            List.of(m.id(), JsonCodec.write(m.payload())));
      }
      return null;
    });
    // a rolled-back transaction also rolls back its CREATE TABLE statements
    tableOwners.putAll(claims);
    createdTables.addAll(created);
    log.debug("TablePerCollectionStrategy: wrote {} record(s)", batch.size());
  }

  @Override
  public StorageRecord readRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    Objects.requireNonNull(id, "id");
    if (kind == RecordKind.META) {
      Row row = db.queryOne("SELECT data FROM sharedb_meta WHERE id = ?", List.of(id));
      return (row == null) ? null : metaRecord(id, row);
    }

    String actual = collection;
    if (LayoutStrategy.isUnspecified(collection)) {
      actual = collectionOf(db, id);
      if (actual == null) return null;
    }
    String table = docTable(actual);
    if (!knownTable(db, actual, table)) return null;

    Row row = db.queryOne("SELECT data FROM " + quote(table) + " WHERE id = ? AND collection = ?", List.of(id, actual));
    return (row == null) ? null : decryptRecordForCollection(json(row, "data"), actual);
  }

  @Override
  public List<StorageRecord> readAllRecords(DatabaseOperations db, RecordKind kind, String collection) {
    List<StorageRecord> out = new ArrayList<>();
    if (kind == RecordKind.META) {
      for (Row row : db.queryAll("SELECT id, data FROM sharedb_meta")) out.add(metaRecord(row.string("id"), row));
      return out;
    }

    List<String> collections = LayoutStrategy.isUnspecified(collection)
        ? knownCollections(db)
        : List.of(collection);
    for (String c : collections) {
      String table = docTable(c);
      if (!knownTable(db, c, table)) continue;
      for (Row row : db.queryAll("SELECT data FROM " + quote(table) + " WHERE collection = ?", List.of(c))) {
        out.add(decryptRecordForCollection(json(row, "data"), c));
      }
    }
    return out;
  }

  @Override
  public List<StorageRecord> readRecordsBulk(DatabaseOperations db, RecordKind kind, String collection, List<String> ids) {
    if (ids == null || ids.isEmpty()) return List.of();

    if (kind == RecordKind.META) {
      List<StorageRecord> out = new ArrayList<>();
      for (Row row : db.queryAll("SELECT id, data FROM sharedb_meta WHERE id IN (" + placeholders(ids.size()) + ")", ids)) {
        out.add(metaRecord(row.string("id"), row));
      }
      log.debug("TablePerCollectionStrategy: bulk read {}/{} meta record(s)", out.size(), ids.size());
      return out;
    }

    if (LayoutStrategy.isUnspecified(collection)) {
      List<StorageRecord> out = new ArrayList<>();
      for (var e : collectionsOf(db, ids).entrySet()) out.addAll(bulkFromTable(db, e.getKey(), e.getValue()));
      return out;
    }
    return bulkFromTable(db, collection, ids);
  }

  @Override
  public void deleteRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    Objects.requireNonNull(id, "id");
    if (kind == RecordKind.META) {
      db.execute("DELETE FROM sharedb_meta WHERE id = ?", List.of(id));
      return;
    }

    inWriteTx(db, tx -> {
      String actual = LayoutStrategy.isUnspecified(collection) ? collectionOf(tx, id) : collection;
      if (actual == null) return null;
      String table = docTable(actual);
      if (knownTable(tx, actual, table)) {
        tx.execute("DELETE FROM " + quote(table) + " WHERE id = ? AND collection = ?", List.of(id, actual));
      }
      tx.execute("DELETE FROM sharedb_inventory WHERE collection = ? AND doc_id = ?", List.of(actual, id));
      return null;
    });
    log.debug("TablePerCollectionStrategy: deleted {} from {}", id, collection);
  }

  @Override
  public void updateInventoryItem(DatabaseOperations db, String collection, String docId, long version,
                                  InventoryOperation op) {
    Objects.requireNonNull(op, "op");
    requireInventoryKey(collection, docId);
    if (op.isUpsert()) {
      upsertInventory(db, collection, docId, version, clock.millis());
    } else {
      db.execute("DELETE FROM sharedb_inventory WHERE collection = ? AND doc_id = ?", List.of(collection, docId));
    }
    log.debug("TablePerCollectionStrategy: inventory {} {}/{}", op, collection, docId);
  }

  @Override
  public Inventory readInventory(DatabaseOperations db) {
    Inventory.Builder b = Inventory.builder();
    for (Row row : db.queryAll("SELECT collection, doc_id, version FROM sharedb_inventory ORDER BY collection, doc_id")) {
      Long v = row.longValue("version");
      b.put(row.string("collection"), row.string("doc_id"), v == null ? StorageRecord.DEFAULT_VERSION : v);
    }
    return b.build();
  }

  /** The inventory table is created with the schema; this returns its current content. */
  @Override
  public Inventory initializeInventory(DatabaseOperations db) {
    return readInventory(db);
  }

  @Override
  public void deleteAllTables(DatabaseOperations db) {
    Set<String> tables = new LinkedHashSet<>();
    tables.add(META_TABLE);
    tables.add(INVENTORY_TABLE);
    for (String c : createdTables) tables.add(tableNameFor(c));
    for (String c : options.collections().keySet()) tables.add(tableNameFor(c));

    for (Row row : db.queryAll("SELECT name, sql FROM sqlite_master WHERE type = 'table'")) {
      String name = row.string("name");
      String sql = row.string("sql");
      if (name == null || name.toLowerCase(Locale.ROOT).startsWith("sqlite_")) continue;
      if (sql != null && sql.endsWith(COLLECTION_COLUMNS)) tables.add(name);
    }

    for (String t : tables) db.execute("DROP TABLE IF EXISTS " + quote(t));
    createdTables.clear();
    tableOwners.clear();
    log.debug("TablePerCollectionStrategy: dropped {} table(s)", tables.size());
  }

  @Override
  public CollectionStats collectionStats(DatabaseOperations db, String collection) {
    Row row = db.queryOne("SELECT COUNT(*) AS count, MAX(version) AS max_version FROM sharedb_inventory WHERE collection = ?",
        List.of(collection));
    Long count = (row == null) ? null : row.longValue("count");
    Long max = (row == null) ? null : row.longValue("max_version");
    return new CollectionStats(collection, count == null ? 0 : count, max == null ? 0 : max);
  }

  @Override
  public Map<String, Object> encryptRecordForCollection(StorageRecord record, String collection) {
    return encryption.encrypt(record, collection, options.config(collection).encryptedFields());
  }

  @Override
  public StorageRecord decryptRecordForCollection(Map<String, Object> stored, String collection) {
    return encryption.decrypt(stored);
  }

  private void createCollectionTable(DatabaseOperations db, String collection, String table) {
    ddl(db, "CREATE TABLE IF NOT EXISTS " + quote(table) + " " + COLLECTION_COLUMNS);
    for (String field : options.config(collection).indexes()) {
      requireFieldPath(collection, field);
      String index = table + "_" + field.replace('.', '_') + "_idx";
      ddl(db, "CREATE INDEX IF NOT EXISTS " + quote(index) + " ON " + quote(table)
          + " (json_extract(data, '$.payload." + field + "'))");
    }
    log.debug("TablePerCollectionStrategy: ensured table {} for collection {}", table, collection);
  }

  private List<StorageRecord> bulkFromTable(DatabaseOperations db, String collection, List<String> ids) {
    String table = docTable(collection);
    if (!knownTable(db, collection, table)) return List.of();

    List<Object> params = new ArrayList<>(ids.size() + 1);
    params.add(collection);
    params.addAll(ids);
    List<Row> rows = db.queryAll("SELECT id, data FROM " + quote(table)
        + " WHERE collection = ? AND id IN (" + placeholders(ids.size()) + ")", params);

    List<StorageRecord> out = new ArrayList<>(rows.size());
    for (Row row : rows) out.add(decryptRecordForCollection(json(row, "data"), collection));
    log.debug("TablePerCollectionStrategy: bulk read {}/{} record(s) from {}", out.size(), ids.size(), table);
    return out;
  }

  /** Table of a document collection. The reserved meta and inventory names are not document collections. */
  private String docTable(String collection) {
    if (META_COLLECTION.equals(collection) || INVENTORY_COLLECTION.equals(collection)) {
      throw StorageException.malformed("Collection name '" + collection + "' is reserved");
    }
    return tableNameFor(collection);
  }

  /**
   * Table a write to {@code collection} may use, recording the claim in {@code claims}. The owner is looked up in
   * the configured collections, committed claims, the running batch, then the rows of an existing table.
   */
  private String claimTable(DatabaseOperations db, String collection, Map<String, String> claims) {
    String table = docTable(collection);
    String key = table.toLowerCase(Locale.ROOT);
    String owner = configuredOwners.get(key);
    if (owner == null) owner = tableOwners.get(key);
    if (owner == null) owner = claims.get(key);
    if (owner == null) owner = ownerOnDisk(db, collection, table);
    if (owner != null && !owner.equals(collection)) throw collision(collection, table, owner);
    claims.put(key, collection);
    return table;
  }

  /** Some other collection already stored in {@code table}, or {@code null} when there is none or no table. */
  private static String ownerOnDisk(DatabaseOperations db, String collection, String table) {
    Row def = db.queryOne("SELECT sql FROM sqlite_master WHERE type = 'table' AND lower(name) = lower(?)", List.of(table));
    if (def == null) return null;
    String sql = def.string("sql");
    if (sql == null || !sql.endsWith(COLLECTION_COLUMNS)) {
      throw StorageException.malformed("Collection '" + collection + "' maps to table '" + table
          + "', which is not a collection table");
    }
    Row other = db.queryOne("SELECT collection FROM " + quote(table) + " WHERE collection <> ? LIMIT 1", List.of(collection));
    return (other == null) ? null : other.string("collection");
  }

  private static StorageException collision(String collection, String table, String owner) {
    return StorageException.malformed("Collection '" + collection + "' maps to table '" + table
        + "', already used by collection '" + owner + "'");
  }

  private boolean knownTable(DatabaseOperations db, String collection, String table) {
    return createdTables.contains(collection) || tableExists(db, table);
  }

  private static String collectionOf(DatabaseOperations db, String docId) {
    Row row = db.queryOne("SELECT collection FROM sharedb_inventory WHERE doc_id = ? LIMIT 1", List.of(docId));
    return (row == null) ? null : row.string("collection");
  }

  private static Map<String, List<String>> collectionsOf(DatabaseOperations db, List<String> docIds) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (Row row : db.queryAll("SELECT collection, doc_id FROM sharedb_inventory WHERE doc_id IN ("
        + placeholders(docIds.size()) + ")", docIds)) {
      out.computeIfAbsent(row.string("collection"), c -> new ArrayList<>()).add(row.string("doc_id"));
    }
    return out;
  }

  private static List<String> knownCollections(DatabaseOperations db) {
    List<String> out = new ArrayList<>();
    for (Row row : db.queryAll("SELECT DISTINCT collection FROM sharedb_inventory ORDER BY collection")) {
      out.add(row.string("collection"));
    }
    return out;
  }

  private static void requireFieldPath(String collection, String field) {
    if (field == null || !FIELD_PATH.matcher(field).matches()) {
      throw StorageException.malformed("Invalid index field '" + field + "' for collection '" + collection + "'");
    }
  }

  private static void upsertInventory(DatabaseOperations db, String collection, String docId, long version, long now) {
    db.execute("INSERT OR REPLACE INTO sharedb_inventory (collection, doc_id, version, updated_at) VALUES (?, ?, ?, ?)",
        List.of(collection, docId, version, now));
  }
}
