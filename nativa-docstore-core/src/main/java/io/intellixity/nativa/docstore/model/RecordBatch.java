package io.intellixity.nativa.docstore.model;

import java.util.List;

/** Records to write in one call, grouped by kind. */
public record RecordBatch(List<StorageRecord> docs, List<StorageRecord> meta) {
  public RecordBatch {
    docs = (docs == null) ? List.of() : List.copyOf(docs);
    meta = (meta == null) ? List.of() : List.copyOf(meta);
  }

  public static RecordBatch ofDocs(StorageRecord... docs) {
    return new RecordBatch(List.of(docs), List.of());
  }

  public static RecordBatch ofMeta(StorageRecord... meta) {
    return new RecordBatch(List.of(), List.of(meta));
  }

  public boolean isEmpty() { return docs.isEmpty() && meta.isEmpty(); }

  public int size() { return docs.size() + meta.size(); }
}
