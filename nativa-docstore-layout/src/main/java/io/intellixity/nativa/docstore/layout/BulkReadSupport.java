package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.model.RecordKind;
import io.intellixity.nativa.docstore.model.StorageRecord;

import java.util.List;

/**
 * Optional capability of a {@link LayoutStrategy}: fetch many ids with one statement.
 * <p>
 * Results carry the same records {@link LayoutStrategy#readRecord} would return for each id, in no particular
 * order; missing ids are simply absent. An empty id list returns an empty list without touching the database.
 */
public interface BulkReadSupport {
  List<StorageRecord> readRecordsBulk(DatabaseOperations db, RecordKind kind, String collection, List<String> ids);
}
