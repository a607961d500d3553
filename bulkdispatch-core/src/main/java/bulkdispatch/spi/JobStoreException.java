package bulkdispatch.spi;

/**
 * Unchecked exception for job persistence failures, typically wrapping a
 * {@link java.sql.SQLException}.
 */
public class JobStoreException extends RuntimeException {
  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
