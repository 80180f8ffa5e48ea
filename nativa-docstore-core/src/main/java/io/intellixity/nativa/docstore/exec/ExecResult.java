package io.intellixity.nativa.docstore.exec;

/** Outcome of a non-query statement. {@code lastInsertId} is 0 when the binding cannot report one. */
public record ExecResult(long changes, long lastInsertId) {
  public static final ExecResult NONE = new ExecResult(0, 0);
}
