package io.intellixity.nativa.docstore.model;

import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.json.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class InventoryTest {

  @Test
  void removing_last_doc_drops_the_collection() {
    Inventory inv = Inventory.builder()
        .put("users", "users/u1", 1)
        .put("users", "users/u2", 2)
        .put("posts", "posts/p1", 1)
        .remove("posts", "posts/p1")
        .build();

    assertEquals(Map.of("users", Map.of("users/u1", 1L, "users/u2", 2L)), inv.collections());
    assertFalse(inv.collections().containsKey("posts"));
    assertEquals(2, inv.documentCount());
  }

  @Test
  void remove_of_unknown_entry_is_noop() {
    Inventory inv = Inventory.builder().remove("ghost", "ghost/1").build();
    assertTrue(inv.isEmpty());
    assertSame(Inventory.empty(), inv);
  }

  @Test
  void json_form_round_trips_through_jackson() {
    Inventory inv = Inventory.builder().put("users", "users/u1", 4).build();
    String json = JsonCodec.write(inv.toJsonMap());
    assertEquals("{\"collections\":{\"users\":{\"users/u1\":4}}}", json);
    assertEquals(inv, Inventory.fromJsonMap(JsonCodec.readMap(json)));
  }

  @Test
  void from_json_tolerates_missing_collections() {
    assertTrue(Inventory.fromJsonMap(Map.of()).isEmpty());
    assertTrue(Inventory.fromJsonMap(null).isEmpty());
  }

  @Test
  void snapshot_is_immutable() {
    Inventory inv = Inventory.builder().put("users", "users/u1", 1).build();
    assertThrows(UnsupportedOperationException.class, () -> inv.collections().put("x", Map.of()));
    assertThrows(UnsupportedOperationException.class, () -> inv.collections().get("users").put("y", 1L));
  }

  @Test
  void operation_names_parse() {
    assertEquals(InventoryOperation.ADD, InventoryOperation.fromName("add"));
    assertEquals(InventoryOperation.UPDATE, InventoryOperation.fromName("update"));
    assertEquals(InventoryOperation.REMOVE, InventoryOperation.fromName("remove"));
    StorageException e = assertThrows(StorageException.class, () -> InventoryOperation.fromName("upsert"));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
  }

  @Test
  void record_collection_and_version_defaults() {
    StorageRecord r = new StorageRecord("users/u1", Map.of("collection", "users"));
    assertEquals("users", r.collection());
    assertEquals(1L, r.version());
    assertEquals(7L, new StorageRecord("x", Map.of("v", 7)).version());
    assertNull(new StorageRecord("x", Map.of("collection", " ")).collection());
    assertNull(new StorageRecord("x", Map.of("collection", 5)).collection());
  }
}
