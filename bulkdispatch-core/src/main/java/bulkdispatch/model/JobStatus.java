package bulkdispatch.model;

/**
 * Lifecycle status of a {@link Job}.
 *
 * <p>Allowed transitions:
 * <pre>
 * PENDING -&gt; RUNNING | FAILED
 * RUNNING -&gt; PAUSED | CANCELLED | COMPLETED | FAILED
 * PAUSED  -&gt; RUNNING | CANCELLED | FAILED
 * </pre>
 * {@code COMPLETED}, {@code CANCELLED} and {@code FAILED} are terminal.
 */
public enum JobStatus {
  PENDING(0),
  RUNNING(1),
  PAUSED(2),
  COMPLETED(3),
  CANCELLED(4),
  FAILED(5);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }

  /** Only pending and paused jobs may be (re)started. */
  public boolean isStartable() {
    return this == PENDING || this == PAUSED;
  }

  public boolean canTransitionTo(JobStatus next) {
    return switch (this) {
      case PENDING -> next == RUNNING || next == FAILED;
      case RUNNING -> next == PAUSED || next == CANCELLED || next == COMPLETED || next == FAILED;
      case PAUSED -> next == RUNNING || next == CANCELLED || next == FAILED;
      case COMPLETED, CANCELLED, FAILED -> false;
    };
  }

  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
