package bulkdispatch.dispatch;

import bulkdispatch.model.Job;
import bulkdispatch.model.JobStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pause/resume/cancel gate for one execution of a {@link Job}.
 *
 * <p>Operator threads call {@link #pause()}, {@link #resume()} and {@link #cancel()}; the job's
 * worker thread blocks in {@link #awaitIfPaused()} and {@link #sleep(Duration)}. Status changes
 * and gate changes happen under one lock, so a worker never observes a paused status with an
 * open gate.
 *
 * <p>A control created with {@code releaseOnPause} does not hold the worker on a closed gate:
 * {@link #awaitIfPaused()} and {@link #sleep(Duration)} return {@code false} and the execution
 * is marked {@linkplain #isReleased() released}. A released execution cannot be resumed; the
 * job is started again from its persisted cursor instead.
 *
 * <p>This class is thread-safe.
 */
public final class JobControl {
  private final Job job;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final boolean releaseOnPause;
  private volatile boolean paused;
  private volatile boolean cancelled;
  private volatile boolean released;

  public JobControl(Job job, Clock clock) {
    this(job, clock, false);
  }

  /**
   * @param releaseOnPause whether a pause ends the execution instead of blocking it
   */
  public JobControl(Job job, Clock clock, boolean releaseOnPause) {
    this.job = Objects.requireNonNull(job, "job");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.releaseOnPause = releaseOnPause;
  }

  public Job job() {
    return job;
  }

  /**
   * Closes the gate. Only a {@code RUNNING} job can be paused; the send in progress, if any,
   * completes first.
   *
   * @return {@code true} if the job is now paused
   */
  public boolean pause() {
    lock.lock();
    try {
      if (!job.transitionTo(JobStatus.PAUSED, clock.instant())) {
        return false;
      }
      paused = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens the gate closed by {@link #pause()}.
   *
   * @return {@code true} if the job is running again; {@code false} if it is not paused or
   *     the execution was already released
   */
  public boolean resume() {
    lock.lock();
    try {
      if (!paused || released || !job.transitionTo(JobStatus.RUNNING, clock.instant())) {
        return false;
      }
      paused = false;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels a {@code RUNNING} or {@code PAUSED} job and wakes its worker.
   *
   * @return {@code true} if the job is now cancelled
   */
  public boolean cancel() {
    lock.lock();
    try {
      if (!job.transitionTo(JobStatus.CANCELLED, clock.instant())) {
        return false;
      }
      cancelled = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the execution without changing the job's status. Used when the job record is
   * about to be removed.
   */
  public void abort() {
    lock.lock();
    try {
      cancelled = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isPaused() {
    return paused;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Whether the execution gave up its worker because the job was paused. */
  public boolean isReleased() {
    return released;
  }

  /**
   * Blocks while the gate is closed, returning at once when cancelled. With
   * {@code releaseOnPause} a closed gate releases the execution instead of blocking.
   *
   * @return {@code true} if the worker may go on; {@code false} if cancelled or released
   */
  public boolean awaitIfPaused() throws InterruptedException {
    lock.lock();
    try {
      while (paused && !cancelled) {
        if (releaseIfPaused()) {
          return false;
        }
        changed.await();
      }
      return !cancelled;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for {@code duration} unless cancelled first. With {@code releaseOnPause} a pause
   * also ends the wait and releases the execution.
   *
   * @return {@code false} if cancelled or released before the full duration elapsed
   */
  public boolean sleep(Duration duration) throws InterruptedException {
    long remaining = duration.toNanos();
    lock.lock();
    try {
      while (!cancelled && remaining > 0) {
        if (releaseIfPaused()) {
          return false;
        }
        remaining = changed.awaitNanos(remaining);
      }
      return !cancelled;
    } finally {
      lock.unlock();
    }
  }

  // caller holds the lock
  private boolean releaseIfPaused() {
    if (releaseOnPause && paused) {
      released = true;
    }
    return released;
  }
}
