package bulkdispatch;

import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fan-out {@link JobListener} holding global listeners and listeners bound to one job id.
 * A failing listener is logged and does not prevent the others from being called.
 *
 * <p>This class is thread-safe.
 */
final class JobListeners implements JobListener {
  private static final Logger logger = Logger.getLogger(JobListeners.class.getName());

  private final List<JobListener> global = new CopyOnWriteArrayList<>();
  private final Map<String, List<JobListener>> perJob = new ConcurrentHashMap<>();

  void add(JobListener listener) {
    global.add(Objects.requireNonNull(listener, "listener"));
  }

  void add(String jobId, JobListener listener) {
    Objects.requireNonNull(listener, "listener");
    perJob.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(listener);
  }

  boolean remove(JobListener listener) {
    boolean removed = global.remove(listener);
    for (List<JobListener> listeners : perJob.values()) {
      removed |= listeners.remove(listener);
    }
    return removed;
  }

  void removeJob(String jobId) {
    perJob.remove(jobId);
  }

  @Override
  public void onProgress(JobSnapshot job) {
    fire(job.id(), l -> l.onProgress(job));
  }

  @Override
  public void onStatusChanged(JobSnapshot job, JobStatus previous) {
    fire(job.id(), l -> l.onStatusChanged(job, previous));
  }

  @Override
  public void onIdentitySwitch(String jobId, String fromIdentity, String toIdentity, Duration delay) {
    fire(jobId, l -> l.onIdentitySwitch(jobId, fromIdentity, toIdentity, delay));
  }

  @Override
  public void onThrottled(String jobId, String identity, String recipient, Duration retryAfter) {
    fire(jobId, l -> l.onThrottled(jobId, identity, recipient, retryAfter));
  }

  private void fire(String jobId, Consumer<JobListener> event) {
    for (JobListener listener : global) {
      fireOne(listener, event);
    }
    List<JobListener> bound = perJob.get(jobId);
    if (bound != null) {
      for (JobListener listener : bound) {
        fireOne(listener, event);
      }
    }
  }

  private static void fireOne(JobListener listener, Consumer<JobListener> event) {
    try {
      event.accept(listener);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Job listener " + listener + " failed", e);
    }
  }
}
