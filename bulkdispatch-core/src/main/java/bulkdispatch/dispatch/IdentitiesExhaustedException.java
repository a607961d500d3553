package bulkdispatch.dispatch;

/**
 * Raised inside the engine when every identity of a job failed in a row without any
 * recipient being processed. Ends the job as {@code FAILED}.
 */
public final class IdentitiesExhaustedException extends RuntimeException {
  public IdentitiesExhaustedException(String message) {
    super(message);
  }
}
