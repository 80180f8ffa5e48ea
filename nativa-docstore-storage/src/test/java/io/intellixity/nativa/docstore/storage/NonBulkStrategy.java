package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Delegating strategy without a bulk path; reads of {@code failingId} raise an IO error. */
final class NonBulkStrategy implements LayoutStrategy {
  private final LayoutStrategy delegate;
  private final String failingId;
  final List<String> reads = new ArrayList<>();

  NonBulkStrategy(LayoutStrategy delegate, String failingId) {
    this.delegate = delegate;
    this.failingId = failingId;
  }

  @Override public String id() { return "non-bulk"; }
  @Override public InventoryRepresentation inventoryRepresentation() { return delegate.inventoryRepresentation(); }
  @Override public void initializeSchema(DatabaseOperations db) { delegate.initializeSchema(db); }
  @Override public boolean validateSchema(DatabaseOperations db) { return delegate.validateSchema(db); }
  @Override public String tableNameFor(String collection) { return delegate.tableNameFor(collection); }
  @Override public void writeRecords(DatabaseOperations db, RecordBatch batch) { delegate.writeRecords(db, batch); }

  @Override public StorageRecord readRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    reads.add(id);
    if (id.equals(failingId)) throw StorageException.io("read failed for " + id, null);
    return delegate.readRecord(db, kind, collection, id);
  }

  @Override public List<StorageRecord> readAllRecords(DatabaseOperations db, RecordKind kind, String collection) {
    return delegate.readAllRecords(db, kind, collection);
  }

  @Override public void deleteRecord(DatabaseOperations db, RecordKind kind, String collection, String id) {
    delegate.deleteRecord(db, kind, collection, id);
  }

  @Override public void updateInventoryItem(DatabaseOperations db, String collection, String docId, long version,
                                            InventoryOperation op) {
    delegate.updateInventoryItem(db, collection, docId, version, op);
  }

  @Override public Inventory readInventory(DatabaseOperations db) { return delegate.readInventory(db); }
  @Override public Inventory initializeInventory(DatabaseOperations db) { return delegate.initializeInventory(db); }
  @Override public void deleteAllTables(DatabaseOperations db) { delegate.deleteAllTables(db); }

  @Override public CollectionStats collectionStats(DatabaseOperations db, String collection) {
    return delegate.collectionStats(db, collection);
  }

  @Override public Map<String, Object> encryptRecordForCollection(StorageRecord record, String collection) {
    return delegate.encryptRecordForCollection(record, collection);
  }

  @Override public StorageRecord decryptRecordForCollection(Map<String, Object> stored, String collection) {
    return delegate.decryptRecordForCollection(stored, collection);
  }
}
