package io.intellixity.nativa.docstore.pool;

import java.util.concurrent.atomic.AtomicInteger;

/** Stand-in connection: validity is toggled by the test, close is observable. */
final class FakeConnection implements AutoCloseable {
  private static final AtomicInteger IDS = new AtomicInteger();

  final int id = IDS.incrementAndGet();
  volatile boolean valid = true;
  volatile boolean closed;

  @Override public void close() { closed = true; }

  /** Factory validating through {@link #valid}; optionally failing every create. */
  static final class Factory implements ConnectionFactory<FakeConnection> {
    final AtomicInteger created = new AtomicInteger();
    volatile boolean failCreates;

    @Override public FakeConnection create() {
      if (failCreates) throw new IllegalStateException("database file locked");
      created.incrementAndGet();
      return new FakeConnection();
    }

    @Override public boolean validate(FakeConnection c) { return c.valid && !c.closed; }
  }
}
