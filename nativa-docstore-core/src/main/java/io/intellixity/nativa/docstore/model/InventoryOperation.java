package io.intellixity.nativa.docstore.model;

import io.intellixity.nativa.docstore.error.StorageException;

import java.util.Locale;

public enum InventoryOperation {
  ADD,
  UPDATE,
  REMOVE;

  /** Parse the wire names {@code add}, {@code update}, {@code remove}. */
  public static InventoryOperation fromName(String name) {
    if (name == null) throw StorageException.malformed("Invalid inventory operation: null");
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "add" -> ADD;
      case "update" -> UPDATE;
      case "remove" -> REMOVE;
      default -> throw StorageException.malformed("Invalid inventory operation: " + name);
    };
  }

  public boolean isUpsert() { return this != REMOVE; }
}
