package io.intellixity.nativa.docstore.pool;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Pool sizing and timing.
 * <p>
 * Property keys (all optional, durations in milliseconds): {@code docstore.pool.maxConnections},
 * {@code docstore.pool.minConnections}, {@code docstore.pool.acquireTimeoutMs},
 * {@code docstore.pool.createTimeoutMs}, {@code docstore.pool.destroyTimeoutMs},
 * {@code docstore.pool.idleTimeoutMs}, {@code docstore.pool.evictionIntervalMs},
 * {@code docstore.pool.testOnBorrow}, {@code docstore.pool.testOnReturn}.
 */
public record PoolSettings(
    int maxConnections,
    int minConnections,
    Duration acquireTimeout,
    Duration createTimeout,
    Duration destroyTimeout,
    Duration idleTimeout,
    Duration evictionInterval,
    boolean testOnBorrow,
    boolean testOnReturn
) {
  public static final String PREFIX = "docstore.pool.";

  public PoolSettings {
    if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be >= 1");
    if (minConnections < 0) throw new IllegalArgumentException("minConnections must be >= 0");
    if (minConnections > maxConnections) {
      throw new IllegalArgumentException("minConnections (" + minConnections + ") exceeds maxConnections (" + maxConnections + ")");
    }
    requirePositive(acquireTimeout, "acquireTimeout");
    requirePositive(createTimeout, "createTimeout");
    requirePositive(destroyTimeout, "destroyTimeout");
    requirePositive(idleTimeout, "idleTimeout");
    requirePositive(evictionInterval, "evictionInterval");
  }

  public static PoolSettings defaults() { return builder().build(); }

  public static Builder builder() { return new Builder(); }

  public static PoolSettings fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    Builder b = builder();
    String v;
    if ((v = prop(props, "maxConnections")) != null) b.maxConnections(Integer.parseInt(v));
    if ((v = prop(props, "minConnections")) != null) b.minConnections(Integer.parseInt(v));
    if ((v = prop(props, "acquireTimeoutMs")) != null) b.acquireTimeout(Duration.ofMillis(Long.parseLong(v)));
    if ((v = prop(props, "createTimeoutMs")) != null) b.createTimeout(Duration.ofMillis(Long.parseLong(v)));
    if ((v = prop(props, "destroyTimeoutMs")) != null) b.destroyTimeout(Duration.ofMillis(Long.parseLong(v)));
    if ((v = prop(props, "idleTimeoutMs")) != null) b.idleTimeout(Duration.ofMillis(Long.parseLong(v)));
    if ((v = prop(props, "evictionIntervalMs")) != null) b.evictionInterval(Duration.ofMillis(Long.parseLong(v)));
    if ((v = prop(props, "testOnBorrow")) != null) b.testOnBorrow(Boolean.parseBoolean(v));
    if ((v = prop(props, "testOnReturn")) != null) b.testOnReturn(Boolean.parseBoolean(v));
    return b.build();
  }

  private static String prop(Properties props, String name) {
    String v = props.getProperty(PREFIX + name);
    return (v == null || v.isBlank()) ? null : v.trim();
  }

  private static void requirePositive(Duration d, String name) {
    Objects.requireNonNull(d, name);
    if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
  }

  public static final class Builder {
    private int maxConnections = 5;
    private int minConnections = 2;
    private Duration acquireTimeout = Duration.ofSeconds(5);
    private Duration createTimeout = Duration.ofSeconds(10);
    private Duration destroyTimeout = Duration.ofSeconds(5);
    private Duration idleTimeout = Duration.ofSeconds(30);
    private Duration evictionInterval = Duration.ofSeconds(5);
    private boolean testOnBorrow = true;
    private boolean testOnReturn = true;

    private Builder() {}

    public Builder maxConnections(int v) { this.maxConnections = v; return this; }
    public Builder minConnections(int v) { this.minConnections = v; return this; }
    public Builder acquireTimeout(Duration v) { this.acquireTimeout = v; return this; }
    public Builder createTimeout(Duration v) { this.createTimeout = v; return this; }
    public Builder destroyTimeout(Duration v) { this.destroyTimeout = v; return this; }
    public Builder idleTimeout(Duration v) { this.idleTimeout = v; return this; }
    public Builder evictionInterval(Duration v) { this.evictionInterval = v; return this; }
    public Builder testOnBorrow(boolean v) { this.testOnBorrow = v; return this; }
    public Builder testOnReturn(boolean v) { this.testOnReturn = v; return this; }

    public PoolSettings build() {
      return new PoolSettings(maxConnections, minConnections, acquireTimeout, createTimeout, destroyTimeout,
          idleTimeout, evictionInterval, testOnBorrow, testOnReturn);
    }
  }
}
