package bulkdispatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An authorized sender account.
 *
 * @param handle      unique handle, used as the identity key
 * @param displayName optional display name
 * @param publicId    optional numeric public identifier
 * @param canSend     whether the identity may be used to send
 * @param status      lifecycle status
 * @param routeId     optional egress route assigned to this identity
 * @param sentCount   cumulative successful sends
 * @param errorCount  cumulative failed sends
 * @param lastUsed    last time the identity sent anything, or {@code null}
 */
public record Identity(
    String handle,
    String displayName,
    Long publicId,
    boolean canSend,
    IdentityStatus status,
    String routeId,
    long sentCount,
    long errorCount,
    Instant lastUsed
) {
  public Identity {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(status, "status");
    if (handle.isEmpty()) {
      throw new IllegalArgumentException("handle must not be empty");
    }
  }

  /** Creates an active identity that can send, with no route and no usage. */
  public static Identity active(String handle) {
    return new Identity(handle, null, null, true, IdentityStatus.ACTIVE, null, 0, 0, null);
  }

  public Identity withRoute(String routeId) {
    return new Identity(handle, displayName, publicId, canSend, status, routeId,
        sentCount, errorCount, lastUsed);
  }

  public Identity withStatus(IdentityStatus status, boolean canSend) {
    return new Identity(handle, displayName, publicId, canSend, status, routeId,
        sentCount, errorCount, lastUsed);
  }

  public Identity withUsage(boolean success, Instant at) {
    return new Identity(handle, displayName, publicId, canSend, status, routeId,
        success ? sentCount + 1 : sentCount,
        success ? errorCount : errorCount + 1,
        at);
  }
}
