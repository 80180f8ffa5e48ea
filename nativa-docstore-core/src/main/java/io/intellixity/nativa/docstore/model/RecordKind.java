package io.intellixity.nativa.docstore.model;

/** Which physical store a record belongs to. Meta records are never encrypted or grouped by collection. */
public enum RecordKind {
  DOCS("docs"),
  META("meta");

  private final String wireName;

  RecordKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }
}
