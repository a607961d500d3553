package bulkdispatch.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Pacing with a uniformly random message delay in {@code [minDelay, maxDelay]} (millisecond
 * resolution) and a fixed identity switch delay.
 */
public final class RandomPacingPolicy implements PacingPolicy {
  public static final Duration DEFAULT_MIN_DELAY = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(15);
  public static final Duration DEFAULT_SWITCH_DELAY = Duration.ofSeconds(30);
  public static final int DEFAULT_MESSAGES_PER_IDENTITY = 50;

  private final long minDelayMs;
  private final long maxDelayMs;
  private final Duration identitySwitchDelay;
  private final int messagesPerIdentity;

  public RandomPacingPolicy(Duration minDelay, Duration maxDelay, Duration identitySwitchDelay,
      int messagesPerIdentity) {
    Objects.requireNonNull(minDelay, "minDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    Objects.requireNonNull(identitySwitchDelay, "identitySwitchDelay");
    if (minDelay.isNegative() || identitySwitchDelay.isNegative()) {
      throw new IllegalArgumentException("Delays must not be negative");
    }
    if (maxDelay.compareTo(minDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= minDelay, got: "
          + minDelay + " > " + maxDelay);
    }
    if (messagesPerIdentity < 1) {
      throw new IllegalArgumentException("messagesPerIdentity must be >= 1, got: " + messagesPerIdentity);
    }
    this.minDelayMs = minDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
    this.identitySwitchDelay = identitySwitchDelay;
    this.messagesPerIdentity = messagesPerIdentity;
  }

  /** 5-15 s between messages, 30 s after switching identity, 50 messages per identity. */
  public static RandomPacingPolicy defaults() {
    return new RandomPacingPolicy(DEFAULT_MIN_DELAY, DEFAULT_MAX_DELAY, DEFAULT_SWITCH_DELAY,
        DEFAULT_MESSAGES_PER_IDENTITY);
  }

  @Override
  public Duration nextMessageDelay() {
    if (minDelayMs == maxDelayMs) {
      return Duration.ofMillis(minDelayMs);
    }
    return Duration.ofMillis(ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1));
  }

  @Override
  public Duration identitySwitchDelay() {
    return identitySwitchDelay;
  }

  @Override
  public int messagesPerIdentity() {
    return messagesPerIdentity;
  }
}
