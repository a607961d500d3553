package bulkdispatch.spi;

/**
 * Thrown when a sender identity (or the route it connects through) cannot be used right now.
 * The engine reacts by rotating to the next identity.
 */
public class ChannelUnavailableException extends RuntimeException {

  private final String identity;

  public ChannelUnavailableException(String identity, String message) {
    super(message);
    this.identity = identity;
  }

  public ChannelUnavailableException(String identity, String message, Throwable cause) {
    super(message, cause);
    this.identity = identity;
  }

  /** Handle of the identity that could not be used. */
  public String identity() {
    return identity;
  }
}
