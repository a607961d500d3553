package bulkdispatch;

import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;

import java.time.Duration;

/**
 * Observer of job progress.
 *
 * <h2>Execution Model</h2>
 * <p>Callbacks run synchronously on the thread that caused the event: the job's worker thread
 * for progress, throttling and identity switches, the operator's thread for pause, resume and
 * cancel. Implementations should return quickly; a slow listener slows the job down.
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown by a listener are logged and otherwise ignored. They never affect the
 * job.
 *
 * <p>All methods have empty defaults so implementations override only what they need.
 */
public interface JobListener {

  /** Listener that ignores every event. */
  JobListener NOOP = new JobListener() {
  };

  /** Called after each recipient's outcome has been checkpointed. */
  default void onProgress(JobSnapshot job) {
  }

  /** Called after every persisted status transition. */
  default void onStatusChanged(JobSnapshot job, JobStatus previous) {
  }

  /**
   * Called when the job rotates from one identity to the next.
   *
   * @param delay pause applied before the next send, {@link Duration#ZERO} if none
   */
  default void onIdentitySwitch(String jobId, String fromIdentity, String toIdentity, Duration delay) {
  }

  /** Called before the job waits out a provider throttle. */
  default void onThrottled(String jobId, String identity, String recipient, Duration retryAfter) {
  }
}
