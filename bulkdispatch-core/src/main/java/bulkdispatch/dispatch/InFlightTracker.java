package bulkdispatch.dispatch;

/**
 * Per-job mutual exclusion: at most one execution of a job id at a time.
 */
public interface InFlightTracker {
  boolean tryAcquire(String jobId);

  void release(String jobId);

  boolean isInFlight(String jobId);
}
