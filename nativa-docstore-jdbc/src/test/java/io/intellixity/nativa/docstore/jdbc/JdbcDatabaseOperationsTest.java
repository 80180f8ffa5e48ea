package io.intellixity.nativa.docstore.jdbc;

import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.ExecResult;
import io.intellixity.nativa.docstore.exec.Row;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcDatabaseOperationsTest {
  @TempDir Path dir;
  private JdbcDatabaseOperations db;

  @BeforeEach
  void open() throws SQLException {
    db = new SqliteConnectionFactory(dir.resolve("ops.db")).create();
    db.execute("CREATE TABLE kv (k TEXT PRIMARY KEY, v TEXT)");
  }

  @AfterEach
  void close() {
    db.close();
  }

  @Test
  void execute_reports_changes_and_rows_keep_column_order() {
    ExecResult r = db.execute("INSERT INTO kv (k, v) VALUES (?, ?), (?, ?)", List.of("a", "1", "b", "2"));
    assertEquals(2, r.changes());

    List<Row> rows = db.queryAll("SELECT k, v FROM kv ORDER BY k");
    assertEquals(2, rows.size());
    assertEquals(List.of("k", "v"), List.copyOf(rows.get(0).columnNames()));
    assertEquals("a", rows.get(0).string("k"));
    assertEquals("2", rows.get(1).string("v"));
  }

  @Test
  void query_one_returns_null_when_no_row() {
    assertNull(db.queryOne("SELECT v FROM kv WHERE k = ?", List.of("missing")));
    Row count = db.queryOne("SELECT COUNT(*) AS n FROM kv");
    assertEquals(0L, count.longValue("n"));
  }

  @Test
  void null_parameters_bind_as_sql_null() {
    db.execute("INSERT INTO kv (k, v) VALUES (?, ?)", java.util.Arrays.asList("n", null));
    assertTrue(db.queryOne("SELECT v FROM kv WHERE k = 'n'").isNull("v"));
  }

  @Test
  void transaction_commits_on_return() {
    String out = db.transaction(tx -> {
      tx.execute("INSERT INTO kv (k, v) VALUES ('a', '1')");
      tx.execute("INSERT INTO kv (k, v) VALUES ('b', '2')");
      return "done";
    });
    assertEquals("done", out);
    assertEquals(2L, db.queryOne("SELECT COUNT(*) AS n FROM kv").longValue("n"));
  }

  @Test
  void transaction_rolls_back_everything_on_failure() {
    db.execute("INSERT INTO kv (k, v) VALUES ('keep', 'x')");
    assertThrows(IllegalStateException.class, () -> db.transaction(tx -> {
      tx.execute("INSERT INTO kv (k, v) VALUES ('a', '1')");
      tx.execute("UPDATE kv SET v = 'changed' WHERE k = 'keep'");
      throw new IllegalStateException("abort");
    }));
    assertEquals(1L, db.queryOne("SELECT COUNT(*) AS n FROM kv").longValue("n"));
    assertEquals("x", db.queryOne("SELECT v FROM kv WHERE k = 'keep'").string("v"));
  }

  @Test
  void nested_transaction_joins_the_outer_one() {
    assertThrows(StorageException.class, () -> db.transaction(tx -> {
      tx.transaction(inner -> inner.execute("INSERT INTO kv (k, v) VALUES ('inner', '1')"));
      return tx.execute("INSERT INTO kv (k, v) VALUES ('inner', 'dup')");
    }));
    assertNull(db.queryOne("SELECT v FROM kv WHERE k = 'inner'"));
  }

  @Test
  void statement_failure_is_io_error() {
    StorageException e = assertThrows(StorageException.class, () -> db.execute("INSERT INTO nope VALUES (1)"));
    assertEquals(ErrorKind.IO_ERROR, e.kind());
    assertTrue(e.getCause() instanceof SQLException);
  }

  @Test
  void auto_commit_is_restored_after_transaction() throws SQLException {
    db.transaction(tx -> tx.execute("INSERT INTO kv (k, v) VALUES ('a', '1')"));
    assertTrue(db.connection().getAutoCommit());
  }
}
