package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.crypto.RecordCipher;
import io.intellixity.nativa.docstore.error.StorageException;
import io.intellixity.nativa.docstore.exec.DatabaseOperations;
import io.intellixity.nativa.docstore.exec.Row;
import io.intellixity.nativa.docstore.layout.BulkReadSupport;
import io.intellixity.nativa.docstore.layout.LayoutStrategies;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.model.*;
import io.intellixity.nativa.docstore.pool.ConnectionPool;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Public facade of the document store.
 * <p>
 * Usable only between {@link #initialize()} and {@link #close()}. Every other operation checks this on the
 * calling thread and throws {@link StorageException} ({@code NOT_READY}) before scheduling any work; everything
 * else is reported through the returned future.
 * <p>
 * Store names: {@value #META_STORE} addresses metadata records, any other name is a document collection.
 * <p>
 * {@link #tableName(String)} and {@link #executeCrossDbQuery(String, List)} serve callers that query the tables
 * directly, typically joined with an attached database. The layout strategy itself ignores the schema prefix and
 * the collection mapping.
 */
public final class StorageCoordinator {
  public static final String META_STORE = "meta";

  private enum State { NEW, READY, CLOSED }

  private record Target(RecordKind kind, String collection) {}

  private static final AtomicInteger EXECUTOR_IDS = new AtomicInteger();

  private final LayoutStrategy strategy;
  private final ConnectionSource source;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final Logger log;
  private final String schemaPrefix;
  private final boolean crossDbQueries;
  private final UnaryOperator<String> collectionMapping;
  private final Object stateLock = new Object();
  private volatile State state = State.NEW;

  private StorageCoordinator(LayoutStrategy strategy, ConnectionSource source, Executor executor, Logger log,
                             StorageSettings settings, UnaryOperator<String> collectionMapping) {
    this.strategy = strategy;
    this.source = source;
    this.log = log;
    this.schemaPrefix = settings.schemaPrefix();
    this.crossDbQueries = settings.crossDbQueries();
    this.collectionMapping = collectionMapping;
    if (executor == null) {
      this.ownedExecutor = Executors.newCachedThreadPool(daemon("docstore-storage-" + EXECUTOR_IDS.incrementAndGet()));
      this.executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
      this.executor = executor;
    }
  }

  public static Builder builder() { return new Builder(); }

  public LayoutStrategy strategy() { return strategy; }

  public boolean isReady() { return state == State.READY; }

  /** Create the schema, then create or load the inventory. Calling it again re-runs both idempotently. */
  public CompletableFuture<Inventory> initialize() {
    if (state == State.CLOSED) throw StorageException.notReady("Storage has been closed");
    long start = System.nanoTime();
    return CompletableFuture.supplyAsync(() -> source.withConnection(db -> {
      strategy.initializeSchema(db);
      return strategy.initializeInventory(db);
    }), executor).thenApply(inventory -> {
      synchronized (stateLock) {
        if (state == State.CLOSED) throw StorageException.notReady("Storage was closed during initialization");
        state = State.READY;
      }
      log.info("Storage initialized with layout {} in {} ms", strategy.id(), (System.nanoTime() - start) / 1_000_000);
      return inventory;
    });
  }

  public CompletableFuture<Void> writeRecords(RecordBatch batch) {
    Objects.requireNonNull(batch, "batch");
    return submit("writeRecords", db -> {
      strategy.writeRecords(db, batch);
      return null;
    });
  }

  /** Payload of the record, or {@code null} when absent. */
  public CompletableFuture<Map<String, Object>> readRecord(String storeName, String id) {
    Objects.requireNonNull(id, "id");
    Target t = target(storeName);
    return submit("readRecord", db -> {
      StorageRecord r = strategy.readRecord(db, t.kind(), t.collection(), id);
      return (r == null) ? null : r.payload();
    });
  }

  public CompletableFuture<List<StorageRecord>> readAllRecords(String storeName) {
    Target t = target(storeName);
    return submit("readAllRecords", db -> strategy.readAllRecords(db, t.kind(), t.collection()));
  }

  /**
   * Records for the ids that exist, in no particular order. Strategies without a bulk path are read id by id; the
   * first failing read fails the whole call.
   */
  public CompletableFuture<List<StorageRecord>> readRecordsBulk(String storeName, List<String> ids) {
    Target t = target(storeName);
    ensureReady();
    if (ids == null || ids.isEmpty()) return CompletableFuture.completedFuture(List.of());
    List<String> copy = List.copyOf(ids);
    return submit("readRecordsBulk", db -> {
      if (strategy instanceof BulkReadSupport bulk) return bulk.readRecordsBulk(db, t.kind(), t.collection(), copy);
      List<StorageRecord> out = new ArrayList<>(copy.size());
      for (String id : copy) {
        StorageRecord r = strategy.readRecord(db, t.kind(), t.collection(), id);
        if (r != null) out.add(r);
      }
      return out;
    });
  }

  public CompletableFuture<Void> deleteRecord(String storeName, String id) {
    Objects.requireNonNull(id, "id");
    Target t = target(storeName);
    return submit("deleteRecord", db -> {
      strategy.deleteRecord(db, t.kind(), t.collection(), id);
      return null;
    });
  }

  public CompletableFuture<Void> updateInventory(String collection, String docId, long version, InventoryOperation op) {
    Objects.requireNonNull(op, "op");
    return submit("updateInventory", db -> {
      strategy.updateInventoryItem(db, collection, docId, version, op);
      return null;
    });
  }

  /** Same as the enum form; {@code op} is {@code add}, {@code update} or {@code remove}. */
  public CompletableFuture<Void> updateInventory(String collection, String docId, long version, String op) {
    ensureReady();
    InventoryOperation parsed;
    try {
      parsed = InventoryOperation.fromName(op);
    } catch (StorageException e) {
      return CompletableFuture.failedFuture(e);
    }
    return updateInventory(collection, docId, version, parsed);
  }

  public CompletableFuture<Inventory> readInventory() {
    return submit("readInventory", strategy::readInventory);
  }

  public CompletableFuture<CollectionStats> collectionStats(String collection) {
    Objects.requireNonNull(collection, "collection");
    return submit("collectionStats", db -> strategy.collectionStats(db, collection));
  }

  /**
   * Drop every table the strategy owns, then recreate an empty schema and inventory. Tables the strategy does not
   * own are left alone.
   */
  public CompletableFuture<Void> deleteDatabase() {
    return submit("deleteDatabase", db -> {
      strategy.deleteAllTables(db);
      strategy.initializeSchema(db);
      strategy.initializeInventory(db);
      return null;
    });
  }

  /** Run caller work on a connection from this coordinator's source. */
  public <T> CompletableFuture<T> withConnection(Function<DatabaseOperations, T> op) {
    Objects.requireNonNull(op, "op");
    return submit("withConnection", op);
  }

  /**
   * Table name to use in hand-written SQL for a store. The collection mapping, when set, receives {@value #META_STORE},
   * {@code docs} for an unspecified collection, or the collection name. Without one the strategy's table is
   * qualified by the schema prefix, if any.
   */
  public String tableName(String storeName) {
    String logical;
    String physical;
    if (META_STORE.equals(storeName) || LayoutStrategy.META_COLLECTION.equals(storeName)) {
      logical = META_STORE;
      physical = strategy.tableNameFor(LayoutStrategy.META_COLLECTION);
    } else if (LayoutStrategy.isUnspecified(storeName)) {
      logical = LayoutStrategy.DOCS_COLLECTION;
      physical = strategy.tableNameFor(LayoutStrategy.DOCS_COLLECTION);
    } else {
      logical = storeName;
      physical = strategy.tableNameFor(storeName);
    }
    if (collectionMapping != null) {
      return Objects.requireNonNull(collectionMapping.apply(logical), "collection mapping returned null for " + logical);
    }
    return schemaPrefix.isEmpty() ? physical : schemaPrefix + "." + physical;
  }

  /**
   * Run a query, typically joining this store's tables with an attached database. Fails with
   * {@link IllegalStateException} through the future when cross-database queries are disabled.
   */
  public CompletableFuture<List<Row>> executeCrossDbQuery(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    ensureReady();
    if (!crossDbQueries) return CompletableFuture.failedFuture(new IllegalStateException("Cross-database queries are disabled"));
    List<?> args = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    return submit("executeCrossDbQuery", db -> db.queryAll(sql, args));
  }

  public StorageStats stats() {
    return new StorageStats(isReady(), strategy.id(), strategy.inventoryRepresentation(), schemaPrefix,
        collectionMapping != null, crossDbQueries, source.poolStats());
  }

  /**
   * Reject further operations, then release the owned connection and executor. A caller-supplied pool or executor
   * stays open. Closing twice is a no-op.
   */
  public CompletableFuture<Void> close() {
    synchronized (stateLock) {
      if (state == State.CLOSED) return CompletableFuture.completedFuture(null);
      state = State.CLOSED;
    }
    try {
      source.close();
      log.debug("Storage closed");
      return CompletableFuture.completedFuture(null);
    } catch (RuntimeException e) {
      log.warn("Failed to close storage connection: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    } finally {
      if (ownedExecutor != null) ownedExecutor.shutdown();
    }
  }

  private <T> CompletableFuture<T> submit(String op, Function<DatabaseOperations, T> work) {
    ensureReady();
    return CompletableFuture.supplyAsync(() -> {
      long start = System.nanoTime();
      T out = source.withConnection(work);
      if (log.isDebugEnabled()) log.debug("Storage {} done in {} us", op, (System.nanoTime() - start) / 1_000);
      return out;
    }, executor);
  }

  private void ensureReady() {
    if (state != State.READY) throw StorageException.notReady("Storage has not been initialized or has been closed");
  }

  private static Target target(String storeName) {
    return META_STORE.equals(storeName) ? new Target(RecordKind.META, null) : new Target(RecordKind.DOCS, storeName);
  }

  private static ThreadFactory daemon(String name) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, name + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  public static final class Builder {
    private ConnectionPool<? extends DatabaseOperations> pool;
    private DatabaseOperations connection;
    private LayoutStrategy strategy;
    private StorageSettings settings = StorageSettings.defaults();
    private RecordCipher cipher;
    private Executor executor;
    private UnaryOperator<String> collectionMapping;
    private Logger log = NOPLogger.NOP_LOGGER;

    private Builder() {}

    /** Borrow a connection from {@code pool} per operation; the caller keeps ownership of the pool. */
    public Builder pool(ConnectionPool<? extends DatabaseOperations> pool) { this.pool = pool; return this; }

    /** Run every operation on {@code connection}; the coordinator closes it. */
    public Builder connection(DatabaseOperations connection) { this.connection = connection; return this; }

    /** Use this strategy instead of building one from the settings. */
    public Builder strategy(LayoutStrategy strategy) { this.strategy = strategy; return this; }
    public Builder settings(StorageSettings settings) { this.settings = Objects.requireNonNull(settings, "settings"); return this; }
    public Builder cipher(RecordCipher cipher) { this.cipher = cipher; return this; }
    public Builder executor(Executor executor) { this.executor = executor; return this; }

    /** Replaces the schema prefix in {@link StorageCoordinator#tableName(String)}. */
    public Builder collectionMapping(UnaryOperator<String> mapping) { this.collectionMapping = mapping; return this; }
    public Builder logger(Logger log) { this.log = (log == null) ? NOPLogger.NOP_LOGGER : log; return this; }

    public StorageCoordinator build() {
      if ((pool == null) == (connection == null)) {
        throw new IllegalStateException("Exactly one of pool or connection must be set");
      }
      ConnectionSource source = (pool != null) ? ConnectionSource.pooled(pool) : ConnectionSource.single(connection, log);
      LayoutStrategy s = (strategy != null)
          ? strategy
          : new LayoutStrategies().create(settings.layout(), settings.layoutOptions(cipher, log));
      return new StorageCoordinator(s, source, executor, log, settings, collectionMapping);
    }
  }
}
