package bulkdispatch.memory;

import bulkdispatch.model.Identity;
import bulkdispatch.model.Route;
import bulkdispatch.spi.Channel;

/**
 * Opens provider sessions for {@link InMemoryIdentityPool}.
 */
@FunctionalInterface
public interface ChannelFactory {

  /**
   * @param route the identity's route, or {@code null} for a direct connection
   * @throws bulkdispatch.spi.ChannelUnavailableException if the session cannot be opened
   */
  Channel open(Identity identity, Route route);

  /** Called when the engine hands a channel back. */
  default void close(Identity identity, Channel channel) {
  }
}
