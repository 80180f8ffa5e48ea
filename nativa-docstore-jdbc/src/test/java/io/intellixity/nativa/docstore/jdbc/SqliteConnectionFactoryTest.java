package io.intellixity.nativa.docstore.jdbc;

import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.pool.ConnectionPool;
import io.intellixity.nativa.docstore.pool.PoolSettings;
import io.intellixity.nativa.docstore.pool.PoolStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteConnectionFactoryTest {
  @TempDir Path dir;

  @Test
  void default_validation_checks_open_connections_only() throws Exception {
    SqliteConnectionFactory f = new SqliteConnectionFactory(dir.resolve("validate.db"));
    JdbcDatabaseOperations ops = f.create();
    assertTrue(f.validate(ops));
    f.destroy(ops);
    assertThrows(StorageException.class, () -> f.validate(ops));
    assertTrue(Files.exists(dir.resolve("validate.db")));
  }

  @Test
  void pooled_connections_share_one_database_file() throws Exception {
    SqliteConnectionFactory f = new SqliteConnectionFactory(dir.resolve("pool.db"), java.time.Duration.ofSeconds(5), true,
        LoggerFactory.getLogger(SqliteConnectionFactoryTest.class));
    PoolSettings s = PoolSettings.builder().maxConnections(2).minConnections(0).build();

    try (ConnectionPool<JdbcDatabaseOperations> pool = new ConnectionPool<>(f, s)) {
      pool.withConnection(db -> db.execute("CREATE TABLE t (n INTEGER)"));

      List<CompletableFuture<Void>> writes = new ArrayList<>();
      for (int i = 0; i < 3; i++) {
        int n = i;
        writes.add(CompletableFuture.runAsync(() ->
            pool.withConnection(db -> db.execute("INSERT INTO t (n) VALUES (?)", List.of(n)))));
      }
      for (CompletableFuture<Void> w : writes) w.get(10, TimeUnit.SECONDS);

      long count = pool.withConnection(db -> db.queryOne("SELECT COUNT(*) AS c FROM t").longValue("c"));
      assertEquals(3, count);

      PoolStats stats = pool.stats();
      assertEquals(5, stats.acquireSuccesses());
      assertTrue(stats.connectionsCreated() <= 2);
      assertEquals(0, stats.validationFailures());
    }
  }
}
