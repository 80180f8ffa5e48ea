package io.intellixity.nativa.docstore.pool;

import io.intellixity.nativa.docstore.error.ErrorKind;
import io.intellixity.nativa.docstore.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Bounded pool of connections to one embedded database.
 * <p>
 * Acquire order: an idle connection (most recently returned first), else a new one while below
 * {@code maxConnections}, else wait until a connection is returned or {@code acquireTimeout} passes.
 * Connections failing validation are destroyed and replaced within the same acquire. Creation is retried up to
 * {@code maxConnections} times per acquire before the acquire fails.
 * <p>
 * A single background evictor destroys connections idle longer than {@code idleTimeout} while the pool is above
 * {@code minConnections}, then tops the pool back up to the minimum.
 */
public final class ConnectionPool<C> implements AutoCloseable {
  private static final AtomicInteger POOL_IDS = new AtomicInteger();

  private final ConnectionFactory<C> factory;
  private final PoolSettings settings;
  private final Logger log;
  private final LongSupplier nanoClock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Deque<Idle<C>> idle = new ArrayDeque<>();
  private final Set<C> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
  private int creating;
  private int pending;
  private boolean closed;

  private final ExecutorService maintenance;
  private final ScheduledExecutorService evictor;

  private final AtomicLong connectionsCreated = new AtomicLong();
  private final AtomicLong connectionsDestroyed = new AtomicLong();
  private final AtomicLong creationFailures = new AtomicLong();
  private final AtomicLong validationSuccesses = new AtomicLong();
  private final AtomicLong validationFailures = new AtomicLong();
  private final AtomicLong acquireSuccesses = new AtomicLong();
  private final AtomicLong acquireFailures = new AtomicLong();
  private final AtomicLong operationFailures = new AtomicLong();

  private record Idle<C>(C connection, long idleSinceNanos) {}

  public ConnectionPool(ConnectionFactory<C> factory, PoolSettings settings) {
    this(factory, settings, NOPLogger.NOP_LOGGER);
  }

  public ConnectionPool(ConnectionFactory<C> factory, PoolSettings settings, Logger log) {
    this(factory, settings, log, System::nanoTime, true);
  }

  ConnectionPool(ConnectionFactory<C> factory, PoolSettings settings, Logger log, LongSupplier nanoClock,
                 boolean startEvictor) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.log = (log == null) ? NOPLogger.NOP_LOGGER : log;
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");

    int id = POOL_IDS.incrementAndGet();
    this.maintenance = Executors.newCachedThreadPool(daemon("docstore-pool-" + id + "-maint"));
    this.evictor = Executors.newSingleThreadScheduledExecutor(daemon("docstore-pool-" + id + "-evictor"));

    this.log.debug("Connection pool initialized with {}", settings);
    if (startEvictor) {
      long every = settings.evictionInterval().toMillis();
      evictor.scheduleWithFixedDelay(this::sweep, every, every, TimeUnit.MILLISECONDS);
      evictor.execute(this::topUp);
    }
  }

  public PoolSettings settings() { return settings; }

  /**
   * Borrow a connection, run {@code op}, return the connection.
   * <p>
   * Failures of {@code op} are rethrown unchanged and counted as operation failures, not acquire failures.
   */
  public <T> T withConnection(Function<? super C, T> op) {
    Objects.requireNonNull(op, "op");
    C c = getConnection();
    try {
      return op.apply(c);
    } catch (RuntimeException | Error e) {
      operationFailures.incrementAndGet();
      throw e;
    } finally {
      releaseConnection(c);
    }
  }

  /** Manual borrow. Every successful call must be paired with {@link #releaseConnection}. */
  public C getConnection() {
    long deadline = nanoClock.getAsLong() + settings.acquireTimeout().toNanos();
    try {
      C c = acquire(deadline);
      acquireSuccesses.incrementAndGet();
      return c;
    } catch (RuntimeException e) {
      acquireFailures.incrementAndGet();
      throw e;
    }
  }

  public void releaseConnection(C connection) {
    Objects.requireNonNull(connection, "connection");
    boolean wasClosed;
    lock.lock();
    try {
      if (!borrowed.contains(connection)) {
        throw new IllegalArgumentException("Connection is not borrowed from this pool");
      }
      wasClosed = closed;
    } finally {
      lock.unlock();
    }

    if (wasClosed || (settings.testOnReturn() && !validate(connection))) {
      discard(connection);
      return;
    }

    lock.lock();
    try {
      borrowed.remove(connection);
      if (closed) {
        destroyLater(connection);
      } else {
        idle.addLast(new Idle<>(connection, nanoClock.getAsLong()));
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Ready once at least {@code minConnections} connections exist. */
  public boolean isReady() {
    lock.lock();
    try {
      return !closed && size() >= settings.minConnections();
    } finally {
      lock.unlock();
    }
  }

  public PoolStats stats() {
    int size, available, out, waiting;
    lock.lock();
    try {
      size = size();
      available = idle.size();
      out = borrowed.size();
      waiting = pending;
    } finally {
      lock.unlock();
    }
    int score = PoolStats.healthScore(validationSuccesses.get(), validationFailures.get(),
        acquireSuccesses.get(), acquireFailures.get(), out, size);
    return new PoolStats(size, available, out, waiting,
        connectionsCreated.get(), connectionsDestroyed.get(), creationFailures.get(),
        validationSuccesses.get(), validationFailures.get(),
        acquireSuccesses.get(), acquireFailures.get(), operationFailures.get(),
        score, PoolStats.healthy(score, size, waiting));
  }

  /**
   * Stop handing out connections, wait up to {@code acquireTimeout} for borrowed ones to come back, then destroy
   * everything idle. Connections returned later are destroyed on return.
   */
  @Override
  public void close() {
    List<C> toDestroy = new ArrayList<>();
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      changed.signalAll();
      log.debug("Closing connection pool");

      long remaining = settings.acquireTimeout().toNanos();
      while (!borrowed.isEmpty() && remaining > 0) {
        try {
          remaining = changed.awaitNanos(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
      if (!borrowed.isEmpty()) log.warn("Closing pool with {} connection(s) still borrowed", borrowed.size());
      for (Idle<C> i : idle) toDestroy.add(i.connection());
      idle.clear();
    } finally {
      lock.unlock();
    }

    evictor.shutdownNow();
    for (C c : toDestroy) destroyLater(c);
    maintenance.shutdown();
    try {
      if (!maintenance.awaitTermination(settings.destroyTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Pool maintenance did not finish within {}", settings.destroyTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.debug("Connection pool closed");
  }

  private C acquire(long deadline) {
    int attempts = 0;
    Throwable lastCreateError = null;

    while (true) {
      Idle<C> candidate = null;
      lock.lock();
      pending++;
      try {
        while (true) {
          if (closed) throw StorageException.io("Connection pool is closed", null);
          candidate = idle.pollLast();
          if (candidate != null) {
            borrowed.add(candidate.connection());
            break;
          }
          if (size() < settings.maxConnections()) {
            if (attempts >= settings.maxConnections()) {
              throw StorageException.io("Could not produce a healthy connection after " + attempts + " attempt(s)",
                  lastCreateError);
            }
            creating++;
            break;
          }
          long remaining = deadline - nanoClock.getAsLong();
          if (remaining <= 0) {
            throw StorageException.io("Timed out after " + settings.acquireTimeout().toMillis()
                + " ms waiting for a connection", null);
          }
          try {
            changed.awaitNanos(remaining);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StorageException.io("Interrupted while waiting for a connection", e);
          }
        }
      } finally {
        pending--;
        lock.unlock();
      }

      C c;
      if (candidate != null) {
        c = candidate.connection();
      } else {
        attempts++;
        try {
          c = createWithTimeout();
        } catch (RuntimeException e) {
          creationFailures.incrementAndGet();
          lastCreateError = e;
          log.warn("Failed to create connection (attempt {}): {}", attempts, e.getMessage());
          lock.lock();
          try {
            creating--;
            changed.signalAll();
          } finally {
            lock.unlock();
          }
          continue;
        }
        lock.lock();
        try {
          creating--;
          borrowed.add(c);
        } finally {
          lock.unlock();
        }
      }

      if (!settings.testOnBorrow() || validate(c)) return c;
      discard(c);
    }
  }

  /** Counted wrapper around {@link ConnectionFactory#validate}; exceptions mean invalid. */
  boolean validate(C connection) {
    boolean ok;
    try {
      ok = factory.validate(connection);
    } catch (RuntimeException e) {
      log.debug("Connection validation error: {}", e.getMessage());
      ok = false;
    }
    (ok ? validationSuccesses : validationFailures).incrementAndGet();
    return ok;
  }

  private C createWithTimeout() {
    log.debug("Creating new connection");
    CompletableFuture<C> f = CompletableFuture.supplyAsync(() -> {
      try {
        return factory.create();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw StorageException.io("Connection factory failed", e);
      }
    }, maintenance);

    C c;
    try {
      c = f.get(settings.createTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      // a late connection has nowhere to go
      f.thenAccept(this::destroyLater);
      throw StorageException.io("Connection creation timed out after " + settings.createTimeout().toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = (e.getCause() == null) ? e : e.getCause();
      throw StorageException.wrap(cause, ErrorKind.IO_ERROR, "Connection creation failed");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      f.thenAccept(this::destroyLater);
      throw StorageException.io("Interrupted while creating a connection", e);
    }
    if (c == null) throw StorageException.io("Connection factory returned null", null);
    connectionsCreated.incrementAndGet();
    return c;
  }

  /** Drop a borrowed connection and destroy it. */
  private void discard(C connection) {
    lock.lock();
    try {
      borrowed.remove(connection);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    destroyLater(connection);
  }

  private void destroyLater(C connection) {
    Runnable destroy = () -> {
      try {
        factory.destroy(connection);
      } catch (Exception e) {
        log.warn("Failed to destroy connection: {}", e.getMessage());
      }
    };
    CompletableFuture<Void> f;
    try {
      f = CompletableFuture.runAsync(destroy, maintenance);
    } catch (RejectedExecutionException e) {
      destroy.run();
      connectionsDestroyed.incrementAndGet();
      return;
    }
    f.orTimeout(settings.destroyTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((ok, err) -> {
          connectionsDestroyed.incrementAndGet();
          if (err != null) log.warn("Connection destroy did not complete: {}", err.toString());
        });
  }

  /** One evictor pass: remove expired idle connections above the minimum, then refill to the minimum. */
  void sweep() {
    List<C> expired = new ArrayList<>();
    lock.lock();
    try {
      if (closed) return;
      long now = nanoClock.getAsLong();
      long maxIdle = settings.idleTimeout().toNanos();
      Iterator<Idle<C>> it = idle.iterator();
      while (it.hasNext() && size() > settings.minConnections()) {
        Idle<C> i = it.next();
        if (now - i.idleSinceNanos() >= maxIdle) {
          it.remove();
          expired.add(i.connection());
        }
      }
      if (!expired.isEmpty()) changed.signalAll();
    } finally {
      lock.unlock();
    }
    for (C c : expired) destroyLater(c);
    if (!expired.isEmpty()) log.debug("Evicted {} idle connection(s)", expired.size());
    topUp();
  }

  /** Create idle connections until {@code minConnections} exist. Failures are logged and left for the next pass. */
  void topUp() {
    while (true) {
      lock.lock();
      try {
        if (closed || size() >= settings.minConnections()) return;
        creating++;
      } finally {
        lock.unlock();
      }

      C c = null;
      try {
        c = createWithTimeout();
      } catch (RuntimeException e) {
        creationFailures.incrementAndGet();
        log.warn("Failed to create minimum connection: {}", e.getMessage());
      }

      lock.lock();
      try {
        creating--;
        if (c != null) {
          if (closed) {
            destroyLater(c);
          } else {
            idle.addFirst(new Idle<>(c, nanoClock.getAsLong()));
          }
        }
        changed.signalAll();
      } finally {
        lock.unlock();
      }
      if (c == null) return;
    }
  }

  private int size() {
    return idle.size() + borrowed.size() + creating;
  }

  private static ThreadFactory daemon(String name) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, name + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
