package io.intellixity.nativa.docstore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of {@code collection -> (docId -> version)}.
 * <p>
 * JSON form: {@code {"collections": {"users": {"u1": 1}}}}.
 */
public final class Inventory {
  public static final String RECORD_ID = "inventory";
  public static final String COLLECTIONS_KEY = "collections";

  private static final Inventory EMPTY = new Inventory(Map.of());

  private final Map<String, Map<String, Long>> collections;

  private Inventory(Map<String, Map<String, Long>> collections) {
    Map<String, Map<String, Long>> copy = new LinkedHashMap<>();
    for (var e : collections.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
    }
    this.collections = Collections.unmodifiableMap(copy);
  }

  public static Inventory empty() { return EMPTY; }

  public static Builder builder() { return new Builder(); }

  public Map<String, Map<String, Long>> collections() { return collections; }

  /** Version for the document, or {@code null} if it is not listed. */
  public Long version(String collection, String docId) {
    Map<String, Long> docs = collections.get(collection);
    return docs == null ? null : docs.get(docId);
  }

  public boolean contains(String collection, String docId) {
    return version(collection, docId) != null;
  }

  public int documentCount() {
    int n = 0;
    for (Map<String, Long> docs : collections.values()) n += docs.size();
    return n;
  }

  public boolean isEmpty() { return collections.isEmpty(); }

  public Builder toBuilder() {
    Builder b = new Builder();
    for (var c : collections.entrySet()) {
      for (var d : c.getValue().entrySet()) b.put(c.getKey(), d.getKey(), d.getValue());
    }
    return b;
  }

  /** JSON-shaped view used by the single-document representation. */
  public Map<String, Object> toJsonMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(COLLECTIONS_KEY, collections);
    return out;
  }

  /** Inverse of {@link #toJsonMap()}; tolerates a missing or empty {@code collections} key. */
  public static Inventory fromJsonMap(Map<String, ?> json) {
    if (json == null) return EMPTY;
    Object raw = json.get(COLLECTIONS_KEY);
    if (!(raw instanceof Map<?, ?> cols)) return EMPTY;
    Builder b = new Builder();
    for (var c : cols.entrySet()) {
      if (!(c.getValue() instanceof Map<?, ?> docs)) continue;
      String collection = String.valueOf(c.getKey());
      for (var d : docs.entrySet()) {
        Object v = d.getValue();
        long version = (v instanceof Number n) ? n.longValue() : StorageRecord.DEFAULT_VERSION;
        b.put(collection, String.valueOf(d.getKey()), version);
      }
    }
    return b.build();
  }

  @Override public boolean equals(Object o) {
    return o instanceof Inventory i && collections.equals(i.collections);
  }

  @Override public int hashCode() { return collections.hashCode(); }

  @Override public String toString() { return "Inventory" + collections; }

  /** Mutable accumulator. Removing the last document of a collection drops the collection key. */
  public static final class Builder {
    private final Map<String, Map<String, Long>> collections = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String collection, String docId, long version) {
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(docId, "docId");
      collections.computeIfAbsent(collection, c -> new LinkedHashMap<>()).put(docId, version);
      return this;
    }

    public Builder remove(String collection, String docId) {
      Map<String, Long> docs = collections.get(collection);
      if (docs == null) return this;
      docs.remove(docId);
      if (docs.isEmpty()) collections.remove(collection);
      return this;
    }

    public Inventory build() {
      return collections.isEmpty() ? EMPTY : new Inventory(collections);
    }
  }
}
