package io.intellixity.nativa.docstore.pool;

/**
 * Point-in-time view of a {@link ConnectionPool}.
 * <p>
 * {@code size} counts idle, borrowed and in-flight creations. {@code pending} counts callers inside an acquire.
 */
public record PoolStats(
    int size,
    int available,
    int borrowed,
    int pending,
    long connectionsCreated,
    long connectionsDestroyed,
    long creationFailures,
    long validationSuccesses,
    long validationFailures,
    long acquireSuccesses,
    long acquireFailures,
    long operationFailures,
    int healthScore,
    boolean healthy
) {
  public static final int HEALTHY_SCORE = 80;

  /**
   * 0..100. Validation and acquire success rates weigh 40% each (100 when nothing was attempted yet);
   * utilization weighs 20% and peaks at half the pool borrowed.
   */
  static int healthScore(long validationOk, long validationFailed, long acquireOk, long acquireFailed,
                         int borrowed, int size) {
    long validations = validationOk + validationFailed;
    long acquisitions = acquireOk + acquireFailed;
    double validationRate = validations > 0 ? (validationOk * 100.0) / validations : 100.0;
    double acquireRate = acquisitions > 0 ? (acquireOk * 100.0) / acquisitions : 100.0;

    double utilizationScore = 0.0;
    if (size > 0) {
      double u = (double) borrowed / size;
      utilizationScore = u <= 0.5 ? u * 100.0 : (1.0 - u) * 100.0;
    }
    return (int) Math.round(validationRate * 0.4 + acquireRate * 0.4 + utilizationScore * 0.2);
  }

  static boolean healthy(int score, int size, int pending) {
    return score >= HEALTHY_SCORE && size > 0 && pending < size;
  }
}
