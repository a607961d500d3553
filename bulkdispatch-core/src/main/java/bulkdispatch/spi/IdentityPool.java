package bulkdispatch.spi;

import bulkdispatch.model.Identity;

import java.util.List;

/**
 * Source of sender identities and their channels.
 */
public interface IdentityPool {

  /**
   * Looks up identities by handle, preserving the order of {@code handles}. Unknown handles
   * are omitted.
   */
  List<Identity> listByHandles(List<String> handles);

  /**
   * Opens (or reuses) a channel for the identity.
   *
   * @throws ChannelUnavailableException if the identity or its route cannot be used
   */
  Channel acquireChannel(Identity identity);

  void releaseChannel(Identity identity, Channel channel);

  /** Updates the identity's cumulative counters and last-used timestamp. */
  void recordUsage(String handle, boolean success);
}
