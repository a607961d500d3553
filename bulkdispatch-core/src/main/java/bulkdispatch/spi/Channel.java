package bulkdispatch.spi;

import bulkdispatch.model.Recipient;

import java.util.Optional;

/**
 * An authenticated session of one identity with the messaging provider.
 *
 * <p>Channels are acquired from the {@link IdentityPool}, cached for the lifetime of one job
 * execution and handed back through {@link IdentityPool#releaseChannel}.
 *
 * <p>Either method may throw {@link ChannelUnavailableException} when the underlying identity
 * or route stops working; any other runtime exception from {@link #deliver} is treated as an
 * unclassified delivery failure.
 */
public interface Channel {

  /**
   * Resolves a recipient into a deliverable target.
   *
   * @return the target, or empty if the recipient does not exist or cannot be addressed
   */
  Optional<AddressableTarget> resolve(Recipient recipient);

  DeliveryOutcome deliver(AddressableTarget target, RenderedContent content);
}
