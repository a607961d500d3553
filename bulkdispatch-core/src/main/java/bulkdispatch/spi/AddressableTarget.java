package bulkdispatch.spi;

/**
 * A recipient resolved by a {@link Channel} into something it can deliver to.
 *
 * @param id     provider-side numeric id
 * @param handle provider-side handle, or {@code null} if the recipient has none
 */
public record AddressableTarget(long id, String handle) {
}
