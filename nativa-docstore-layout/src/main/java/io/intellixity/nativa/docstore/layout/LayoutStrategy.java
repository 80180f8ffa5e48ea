package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.model.CollectionStats;
import io.intellixity.nativa.docstore.model.Inventory;
import io.intellixity.nativa.docstore.model.InventoryOperation;
import io.intellixity.nativa.docstore.model.InventoryRepresentation;
import io.intellixity.nativa.docstore.model.RecordBatch;
import io.intellixity.nativa.docstore.model.RecordKind;
import io.intellixity.nativa.docstore.model.StorageRecord;

import java.util.List;
import java.util.Map;

/**
 * Maps logical collections onto physical tables and issues every statement against them.
 * <p>
 * All operations take the connection to run on; a strategy never holds one. Failures are
 * {@link io.intellixity.nativa.docstore.error.StorageException}s. A {@code collection} of {@code null} or
 * {@value #DOCS_COLLECTION} means "not known by the caller".
 */
public interface LayoutStrategy {
  /** Reserved collection name of the metadata table. */
  String META_COLLECTION = "__meta__";

  /** Reserved collection name of the inventory. */
  String INVENTORY_COLLECTION = "__inventory__";

  /** Collection name callers pass when they only know the document id. */
  String DOCS_COLLECTION = "docs";

  String id();

  InventoryRepresentation inventoryRepresentation();

  /** Create every table and index this strategy needs. Idempotent. */
  void initializeSchema(DatabaseOperations db);

  /** {@code true} when the required tables exist. Never mutates. */
  boolean validateSchema(DatabaseOperations db);

  /** Physical table for a collection, including the reserved meta and inventory names. Pure. */
  String tableNameFor(String collection);

  /**
   * Write a batch atomically and upsert the inventory entry of every document.
   * <p>
   * Every document payload must carry a non-blank {@code collection}; otherwise nothing is written.
   */
  void writeRecords(DatabaseOperations db, RecordBatch batch);

  /** The record, decrypted, or {@code null} when absent. */
  StorageRecord readRecord(DatabaseOperations db, RecordKind kind, String collection, String id);

  List<StorageRecord> readAllRecords(DatabaseOperations db, RecordKind kind, String collection);

  /** Delete a record; documents also lose their inventory entry. Missing rows and tables are a no-op. */
  void deleteRecord(DatabaseOperations db, RecordKind kind, String collection, String id);

  void updateInventoryItem(DatabaseOperations db, String collection, String docId, long version, InventoryOperation op);

  Inventory readInventory(DatabaseOperations db);

  /** Create an empty inventory when none exists; return the current one otherwise. */
  Inventory initializeInventory(DatabaseOperations db);

  /** Drop every table this strategy owns and nothing else. */
  void deleteAllTables(DatabaseOperations db);

  CollectionStats collectionStats(DatabaseOperations db, String collection);

  /** Stored JSON shape of a document destined for {@code collection}. */
  Map<String, Object> encryptRecordForCollection(StorageRecord record, String collection);

  StorageRecord decryptRecordForCollection(Map<String, Object> stored, String collection);

  static boolean isUnspecified(String collection) {
    return collection == null || collection.isBlank() || DOCS_COLLECTION.equals(collection);
  }
}
