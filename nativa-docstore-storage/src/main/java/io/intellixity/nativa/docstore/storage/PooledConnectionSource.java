package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.pool.ConnectionPool;
import io.intellixity.nativa.docstore.pool.PoolStats;

import java.util.Objects;
import java.util.function.Function;

final class PooledConnectionSource implements ConnectionSource {
  private final ConnectionPool<? extends DatabaseOperations> pool;

  PooledConnectionSource(ConnectionPool<? extends DatabaseOperations> pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  @Override public <T> T withConnection(Function<DatabaseOperations, T> op) {
    return pool.withConnection(op);
  }

  @Override public PoolStats poolStats() { return pool.stats(); }

  @Override public void close() {
    // the pool belongs to the caller
  }
}
