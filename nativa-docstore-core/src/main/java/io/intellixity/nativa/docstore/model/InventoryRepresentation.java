package io.intellixity.nativa.docstore.model;

/** How a layout strategy persists the inventory. Both forms expose the same {@link Inventory} snapshot. */
public enum InventoryRepresentation {
  /** Single JSON document in the metadata table, mutated read-modify-write. */
  JSON,

  /** Dedicated {@code (collection, doc_id)} table, mutated by upsert/delete. */
  TABLE
}
