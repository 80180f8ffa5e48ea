package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.pool.ConnectionPool;
import io.intellixity.nativa.docstore.pool.PoolStats;
import org.slf4j.Logger;

import java.util.function.Function;

/** Where a {@link StorageCoordinator} gets the connection for each operation. */
public interface ConnectionSource {
  <T> T withConnection(Function<DatabaseOperations, T> op);

  /** Pool statistics, or {@code null} for a single connection. */
  PoolStats poolStats();

  /** Release whatever this source owns. */
  void close();

  /** Borrow from {@code pool} per operation. The pool stays open when the source is closed. */
  static ConnectionSource pooled(ConnectionPool<? extends DatabaseOperations> pool) {
    return new PooledConnectionSource(pool);
  }

  /** Serialize every operation on one owned connection, closed with the source when it is {@link AutoCloseable}. */
  static ConnectionSource single(DatabaseOperations connection, Logger log) {
    return new SingleConnectionSource(connection, log);
  }
}
