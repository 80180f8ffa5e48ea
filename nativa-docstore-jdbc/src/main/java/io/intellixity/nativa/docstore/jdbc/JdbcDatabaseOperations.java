package io.intellixity.nativa.docstore.jdbc;

import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.ExecResult;
import io.intellixity.nativa.docstore.exec.Row;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.sql.*;
import java.util.*;
import java.util.function.Function;

/**
 * {@link DatabaseOperations} over one JDBC {@link Connection}.
 * <p>
 * Not thread-safe: one caller at a time, which the pool or the coordinator guarantees. {@link ExecResult#lastInsertId()}
 * is always 0 here.
 */
public final class JdbcDatabaseOperations implements DatabaseOperations, AutoCloseable {
  private final String id;
  private final Connection connection;
  private final Logger log;
  private boolean inTransaction;

  public JdbcDatabaseOperations(String id, Connection connection) {
    this(id, connection, NOPLogger.NOP_LOGGER);
  }

  public JdbcDatabaseOperations(String id, Connection connection, Logger log) {
    this.id = Objects.requireNonNull(id, "id");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.log = (log == null) ? NOPLogger.NOP_LOGGER : log;
  }

  public String id() { return id; }

  public Connection connection() { return connection; }

  @Override
  public ExecResult execute(String sql, List<?> params) {
    long start = System.nanoTime();
    debugSql("EXECUTE", sql, params);
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      bindAll(ps, params);
      long n = ps.executeUpdate();
      debugDone("EXECUTE", n, System.nanoTime() - start);
      return new ExecResult(Math.max(n, 0), 0);
    } catch (SQLException e) {
      throw StorageException.io("Statement failed [" + sql + "]: " + e.getMessage(), e);
    }
  }

  @Override
  public Row queryOne(String sql, List<?> params) {
    long start = System.nanoTime();
    debugSql("QUERY_ONE", sql, params);
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      bindAll(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        Row row = rs.next() ? readRow(rs) : null;
        debugDone("QUERY_ONE", row == null ? 0 : 1, System.nanoTime() - start);
        return row;
      }
    } catch (SQLException e) {
      throw StorageException.io("Query failed [" + sql + "]: " + e.getMessage(), e);
    }
  }

  @Override
  public List<Row> queryAll(String sql, List<?> params) {
    long start = System.nanoTime();
    debugSql("QUERY_ALL", sql, params);
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      bindAll(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<Row> out = new ArrayList<>();
        while (rs.next()) out.add(readRow(rs));
        debugDone("QUERY_ALL", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw StorageException.io("Query failed [" + sql + "]: " + e.getMessage(), e);
    }
  }

  @Override
  public <T> T transaction(Function<DatabaseOperations, T> body) {
    Objects.requireNonNull(body, "body");
    if (inTransaction) return body.apply(this);

    boolean previousAutoCommit;
    try {
      previousAutoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      throw StorageException.io("Failed to begin transaction", e);
    }

    inTransaction = true;
    try {
      T out = body.apply(this);
      connection.commit();
      log.debug("docstore.jdbc tx_commit handleId={}", id);
      return out;
    } catch (SQLException e) {
      rollback(e);
      throw StorageException.io("Failed to commit transaction", e);
    } catch (RuntimeException | Error e) {
      rollback(e);
      throw e;
    } finally {
      inTransaction = false;
      try {
        connection.setAutoCommit(previousAutoCommit);
      } catch (SQLException e) {
        log.warn("Failed to restore auto-commit on {}: {}", id, e.getMessage());
      }
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      throw StorageException.io("Failed to close connection " + id, e);
    }
  }

  private void rollback(Throwable cause) {
    try {
      connection.rollback();
      log.debug("docstore.jdbc tx_rollback handleId={} cause={}", id, cause.toString());
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void bindAll(PreparedStatement ps, List<?> params) throws SQLException {
    if (params == null) return;
    for (int i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
  }

  private static Row readRow(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Object> cols = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) cols.put(md.getColumnLabel(i), rs.getObject(i));
    return new Row(cols);
  }

  private void debugSql(String op, String sql, List<?> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("docstore.jdbc op={} bindCount={} handleId={} inTx={} sql={}",
        op, params == null ? 0 : params.size(), id, inTransaction, sql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && params != null) {
      int idx = 1;
      for (Object v : params) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("docstore.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("docstore.jdbc_done op={} handleId={} durationMs={} result={}",
        op, id, durationNanos / 1_000_000.0, result);
  }
}
