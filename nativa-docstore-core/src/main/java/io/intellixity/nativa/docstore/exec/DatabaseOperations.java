package io.intellixity.nativa.docstore.exec;

import java.util.List;
import java.util.function.Function;

/**
 * The statement-level contract every embedded-database binding implements.
 * <p>
 * Statements use positional {@code ?} placeholders. At most one statement runs at a time per instance;
 * parallelism comes from using several instances (see the pool module).
 * <p>
 * Failures are reported as {@link io.intellixity.nativa.docstore.error.StorageException} with kind
 * {@code IO_ERROR}.
 */
public interface DatabaseOperations {
  /** Run a statement that returns no rows. */
  ExecResult execute(String sql, List<?> params);

  /** First row of the result, or {@code null} when there is none. */
  Row queryOne(String sql, List<?> params);

  List<Row> queryAll(String sql, List<?> params);

  /**
   * Run {@code body} in a transaction scoped to the handle passed to it.
   * <p>
   * Commits when {@code body} returns, rolls back and rethrows when it throws. Calling this while a
   * transaction is already open on the same connection joins the open transaction.
   */
  <T> T transaction(Function<DatabaseOperations, T> body);

  default ExecResult execute(String sql) { return execute(sql, List.of()); }
  default Row queryOne(String sql) { return queryOne(sql, List.of()); }
  default List<Row> queryAll(String sql) { return queryAll(sql, List.of()); }
}
