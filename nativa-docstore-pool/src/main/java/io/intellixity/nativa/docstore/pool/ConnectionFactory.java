package io.intellixity.nativa.docstore.pool;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.Row;

/**
 * Produces, checks and disposes the connections a {@link ConnectionPool} hands out.
 * <p>
 * Only {@link #create()} is mandatory. Exceptions from {@link #validate} count as a failed validation; exceptions
 * from {@link #destroy} are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ConnectionFactory<C> {
  C create() throws Exception;

  /** Closes {@link AutoCloseable} connections; anything else is dropped. */
  default void destroy(C connection) throws Exception {
    if (connection instanceof AutoCloseable c) c.close();
  }

  /**
   * Runs {@code SELECT 1 AS test} on {@link DatabaseOperations} connections. Connections of any other type are
   * considered valid when non-null.
   */
  default boolean validate(C connection) {
    if (connection instanceof DatabaseOperations ops) {
      Row row = ops.queryOne("SELECT 1 AS test");
      return row != null && Long.valueOf(1L).equals(row.longValue("test"));
    }
    return connection != null;
  }
}
