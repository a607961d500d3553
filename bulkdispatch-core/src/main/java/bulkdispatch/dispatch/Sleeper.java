package bulkdispatch.dispatch;

import java.time.Duration;

/**
 * Suspends a job's worker thread. Every wait the engine performs (pacing, identity switch,
 * provider throttle) goes through a sleeper so cancellation can cut it short.
 */
@FunctionalInterface
public interface Sleeper {

  /** Waits on the job's control, waking early when the job is cancelled or released. */
  Sleeper CANCELLABLE = (duration, control) -> control.sleep(duration);

  /**
   * @return {@code false} if the job was cancelled (or its execution released) before or
   *     during the wait
   */
  boolean sleep(Duration duration, JobControl control) throws InterruptedException;
}
