package io.intellixity.nativa.docstore.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One result row, keyed by column label in select order.
 * <p>
 * Bindings return whatever scalar the driver produced (String, Integer, Long, Double, byte[]); the typed
 * accessors coerce the usual SQLite affinities.
 */
public final class Row {
  private final Map<String, Object> columns;

  public Row(Map<String, ?> columns) {
    Objects.requireNonNull(columns, "columns");
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static Row of(String column, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(column, value);
    return new Row(m);
  }

  public boolean has(String column) { return columns.containsKey(column); }
  public boolean isNull(String column) { return columns.get(column) == null; }
  public Object raw(String column) { return columns.get(column); }
  public Set<String> columnNames() { return columns.keySet(); }
  public Map<String, Object> asMap() { return columns; }

  public String string(String column) {
    Object v = columns.get(column);
    if (v == null) return null;
    if (v instanceof byte[] b) return new String(b, java.nio.charset.StandardCharsets.UTF_8);
    return String.valueOf(v);
  }

  public Long longValue(String column) {
    Object v = columns.get(column);
    if (v == null) return null;
    if (v instanceof Number n) return n.longValue();
    try {
      return Long.parseLong(String.valueOf(v).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + v, e);
    }
  }

  @Override public boolean equals(Object o) {
    return o instanceof Row r && columns.equals(r.columns);
  }

  @Override public int hashCode() { return columns.hashCode(); }

  @Override public String toString() { return "Row" + columns; }
}
