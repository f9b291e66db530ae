package cafe.woden.ircingest.irc;

import cafe.woden.ircingest.config.IngestProperties;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether a failed session is retried and after how long.
 *
 * <p>Only transport-level failures are retried; anything else (bad configuration, a sink that
 * cannot write) ends ingestion.
 */
final class IngestReconnectPolicy {

  static final long MIN_JITTERED_DELAY_MS = 250;

  private final IngestProperties.Reconnect policy;

  IngestReconnectPolicy(IngestProperties.Reconnect policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * @param attempt 1-based count of consecutive failures
   * @return delay before the next attempt, or empty to give up
   */
  OptionalLong nextDelayMs(Throwable failure, long attempt) {
    if (!policy.enabled()) return OptionalLong.empty();
    if (!isRetryable(failure)) return OptionalLong.empty();
    if (policy.maxAttempts() > 0 && attempt > policy.maxAttempts()) return OptionalLong.empty();
    long delay = backoffDelayMs(
        attempt, policy.initialDelayMs(), policy.maxDelayMs(), policy.multiplier());
    return OptionalLong.of(withJitter(delay, policy.jitterPct()));
  }

  static boolean isRetryable(Throwable failure) {
    return failure instanceof IrcConnectionException || failure instanceof TransportReadException;
  }

  /** {@code firstMs * growth^(attempt-1)}, never above {@code ceilingMs}. */
  static long backoffDelayMs(long attempt, long firstMs, long ceilingMs, double growth) {
    double exponential = firstMs * Math.pow(growth, Math.max(0, attempt - 1));
    return exponential >= ceilingMs ? ceilingMs : (long) exponential;
  }

  /** Spread {@code delayMs} by up to {@code ±spread}; jittered delays never drop below the floor. */
  static long withJitter(long delayMs, double spread) {
    if (spread <= 0) return delayMs;
    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-spread, spread);
    return Math.max(MIN_JITTERED_DELAY_MS, (long) (delayMs * factor));
  }
}
