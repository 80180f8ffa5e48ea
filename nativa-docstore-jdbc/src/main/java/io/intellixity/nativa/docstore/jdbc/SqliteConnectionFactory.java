package io.intellixity.nativa.docstore.jdbc;

import io.intellixity.nativa.docstore.pool.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** Opens {@link JdbcDatabaseOperations} on one SQLite database file through the xerial driver. */
public final class SqliteConnectionFactory implements ConnectionFactory<JdbcDatabaseOperations> {
  private final Path file;
  private final Duration busyTimeout;
  private final boolean wal;
  private final Logger log;
  private final AtomicInteger ids = new AtomicInteger();

  public SqliteConnectionFactory(Path file) {
    this(file, Duration.ofSeconds(5), true, NOPLogger.NOP_LOGGER);
  }

  public SqliteConnectionFactory(Path file, Duration busyTimeout, boolean wal, Logger log) {
    this.file = Objects.requireNonNull(file, "file");
    this.busyTimeout = Objects.requireNonNull(busyTimeout, "busyTimeout");
    this.wal = wal;
    this.log = (log == null) ? NOPLogger.NOP_LOGGER : log;
  }

  public Path file() { return file; }

  public String url() { return "jdbc:sqlite:" + file.toAbsolutePath(); }

  @Override
  public JdbcDatabaseOperations create() throws SQLException {
    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, busyTimeout.toMillis()));
    cfg.enforceForeignKeys(true);
    // writers take the lock at BEGIN so concurrent read-modify-write transactions wait instead of failing
    cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    if (wal) cfg.setJournalMode(SQLiteConfig.JournalMode.WAL);

    Connection c = DriverManager.getConnection(url(), cfg.toProperties());
    String id = "sqlite-" + ids.incrementAndGet();
    log.debug("Opened SQLite connection {} to {}", id, file);
    return new JdbcDatabaseOperations(id, c, log);
  }
}
