package bulkdispatch.schedule;

import bulkdispatch.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-shot start timers for scheduled jobs, at most one per job id.
 *
 * <p>Timers fire on a single daemon thread; the action should only hand the job over to a
 * worker. Scheduling a job again replaces its previous timer.
 *
 * <p>This class is thread-safe. The {@link #close()} method is synchronized with
 * {@link #schedule} so no timer is added after shutdown.
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

  private final Clock clock;
  private final ScheduledExecutorService timer;
  private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public JobScheduler(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timer = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("bulkdispatch-scheduler-"));
  }

  /**
   * Runs {@code action} once at {@code startAt}, or as soon as possible if that is in the past.
   *
   * @return {@code false} if the scheduler is closed
   */
  public synchronized boolean schedule(String jobId, Instant startAt, Runnable action) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(startAt, "startAt");
    Objects.requireNonNull(action, "action");
    if (closed) {
      return false;
    }
    long delayMs = Math.max(0L, Duration.between(clock.instant(), startAt).toMillis());
    try {
      ScheduledFuture<?> future = timer.schedule(() -> fire(jobId, action), delayMs, TimeUnit.MILLISECONDS);
      ScheduledFuture<?> previous = timers.put(jobId, future);
      if (previous != null) {
        previous.cancel(false);
      }
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Could not schedule job " + jobId, e);
      return false;
    }
    logger.info("Job " + jobId + " scheduled to start at " + startAt);
    return true;
  }

  /**
   * @return {@code true} if a pending timer was cancelled
   */
  public boolean cancel(String jobId) {
    ScheduledFuture<?> future = timers.remove(jobId);
    return future != null && future.cancel(false);
  }

  public boolean isScheduled(String jobId) {
    return timers.containsKey(jobId);
  }

  private void fire(String jobId, Runnable action) {
    timers.remove(jobId);
    try {
      action.run();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Scheduled start of job " + jobId + " failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    timers.values().forEach(f -> f.cancel(false));
    timers.clear();
    timer.shutdownNow();
  }
}
