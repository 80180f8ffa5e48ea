package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.model.InventoryRepresentation;
import io.intellixity.nativa.docstore.pool.PoolStats;

/**
 * Snapshot of a coordinator. {@code pool} is {@code null} when running on a single connection;
 * {@code schemaPrefix} is empty when table names are not qualified.
 */
public record StorageStats(
    boolean ready,
    String layout,
    InventoryRepresentation inventoryRepresentation,
    String schemaPrefix,
    boolean collectionMapping,
    boolean crossDbQueries,
    PoolStats pool
) {
  public boolean hasConnectionPool() { return pool != null; }
}
