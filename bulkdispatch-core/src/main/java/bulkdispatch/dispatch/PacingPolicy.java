package bulkdispatch.dispatch;

import java.time.Duration;

/**
 * Controls how fast a job sends.
 *
 * @see RandomPacingPolicy
 */
public interface PacingPolicy {

  /** Delay between two consecutive sends of the same identity. */
  Duration nextMessageDelay();

  /** Delay applied after rotating to the next identity. */
  Duration identitySwitchDelay();

  /** Number of sends after which the job rotates to the next identity. */
  int messagesPerIdentity();
}
