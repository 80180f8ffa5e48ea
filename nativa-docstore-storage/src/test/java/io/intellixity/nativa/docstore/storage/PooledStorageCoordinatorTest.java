package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.crypto.RecordCipher;
import io.intellixity.nativa.docstore.jdbc.JdbcDatabaseOperations;
import io.intellixity.nativa.docstore.jdbc.SqliteConnectionFactory;
import io.intellixity.nativa.docstore.layout.percollection.TablePerCollectionStrategy;
import io.intellixity.nativa.docstore.model.*;
import io.intellixity.nativa.docstore.pool.ConnectionPool;
import io.intellixity.nativa.docstore.pool.PoolSettings;
import io.intellixity.nativa.docstore.pool.PoolStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class PooledStorageCoordinatorTest {
  @TempDir Path dir;
  private ConnectionPool<JdbcDatabaseOperations> pool;
  private StorageCoordinator storage;

  /** Reverses the text and base64-encodes it. */
  private static final RecordCipher REVERSING = new RecordCipher() {
    @Override public String encrypt(String plaintext) {
      return Base64.getEncoder().encodeToString(new StringBuilder(plaintext).reverse().toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override public String decrypt(String ciphertext) {
      return new StringBuilder(new String(Base64.getDecoder().decode(ciphertext), StandardCharsets.UTF_8)).reverse().toString();
    }
  };

  @BeforeEach
  void setUp() {
    SqliteConnectionFactory factory = new SqliteConnectionFactory(dir.resolve("pooled.db"), Duration.ofSeconds(5), true,
        LoggerFactory.getLogger("docstore.jdbc"));
    pool = new ConnectionPool<>(factory, PoolSettings.builder().maxConnections(3).minConnections(1).build(),
        LoggerFactory.getLogger(ConnectionPool.class));

    Properties props = new Properties();
    props.setProperty("docstore.layout", "table-per-collection");
    props.setProperty("docstore.encryption", "true");
    props.setProperty("docstore.collections.users.indexes", "name");
    props.setProperty("docstore.collections.users.encryptedFields", "email");

    storage = StorageCoordinator.builder()
        .pool(pool)
        .settings(StorageSettings.fromProperties(props))
        .cipher(REVERSING)
        .logger(LoggerFactory.getLogger(StorageCoordinator.class))
        .build();
    storage.initialize().join();
  }

  @AfterEach
  void tearDown() {
    storage.close().join();
    pool.close();
  }

  private static StorageRecord user(int n) {
    return new StorageRecord("u" + n, Map.of("collection", "users", "name", "user" + n, "email", n + "@example.com", "v", n));
  }

  @Test
  void concurrent_batches_land_in_collection_tables() {
    List<CompletableFuture<Void>> writes = new ArrayList<>();
    for (int i = 1; i <= 6; i++) writes.add(storage.writeRecords(RecordBatch.ofDocs(user(i))));
    CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

    assertEquals(6, storage.readAllRecords("users").join().size());
    assertEquals(user(4).payload(), storage.readRecord("users", "u4").join());
    assertEquals(new CollectionStats("users", 6, 6), storage.collectionStats("users").join());
    assertEquals(Set.of("u2", "u5"),
        new HashSet<>(storage.readRecordsBulk("users", List.of("u2", "u5", "u99")).join().stream()
            .map(StorageRecord::id).toList()));
  }

  @Test
  void encrypted_fields_are_not_stored_in_plain_text() {
    storage.writeRecords(RecordBatch.ofDocs(user(1))).join();

    String raw = storage.withConnection(db -> db.queryOne("SELECT data FROM \"users\" WHERE id = 'u1'").string("data")).join();
    assertFalse(raw.contains("1@example.com"));
    assertTrue(raw.contains("user1"));
    assertEquals("1@example.com", storage.readRecord("users", "u1").join().get("email"));
  }

  @Test
  void stats_include_pool_and_layout() {
    storage.readInventory().join();
    StorageStats stats = storage.stats();

    assertEquals(TablePerCollectionStrategy.ID, stats.layout());
    assertEquals(InventoryRepresentation.TABLE, stats.inventoryRepresentation());
    assertTrue(stats.hasConnectionPool());
    PoolStats ps = stats.pool();
    assertNotNull(ps);
    assertTrue(ps.acquireSuccesses() >= 2);
    assertEquals(0, ps.acquireFailures());
  }

  @Test
  void closing_the_coordinator_leaves_the_pool_open() {
    storage.close().join();
    assertEquals(1L, pool.<Long>withConnection(db -> db.queryOne("SELECT 1 AS one").longValue("one")));
  }
}
