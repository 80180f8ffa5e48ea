package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.pool.PoolStats;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

final class SingleConnectionSource implements ConnectionSource {
  private final DatabaseOperations connection;
  private final Logger log;
  private final ReentrantLock lock = new ReentrantLock();
  private boolean closed;

  SingleConnectionSource(DatabaseOperations connection, Logger log) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.log = (log == null) ? NOPLogger.NOP_LOGGER : log;
  }

  @Override public <T> T withConnection(Function<DatabaseOperations, T> op) {
    Objects.requireNonNull(op, "op");
    lock.lock();
    try {
      if (closed) throw StorageException.notReady("Connection has been closed");
      return op.apply(connection);
    } finally {
      lock.unlock();
    }
  }

  @Override public PoolStats poolStats() { return null; }

  @Override public void close() {
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      if (connection instanceof AutoCloseable c) c.close();
      log.debug("Single connection closed");
    } catch (Exception e) {
      throw StorageException.wrap(e, ErrorKind.IO_ERROR, "Failed to close connection");
    } finally {
      lock.unlock();
    }
  }
}
