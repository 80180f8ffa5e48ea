package io.intellixity.nativa.docstore.model;

/** Inventory-derived counters for one collection. */
public record CollectionStats(String collection, long documentCount, long maxVersion) {}
