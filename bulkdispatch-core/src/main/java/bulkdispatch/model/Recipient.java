package bulkdispatch.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single entry in a recipient set.
 *
 * @param position       zero-based position in the owning set, or {@code -1} before import
 * @param identifier     raw identifier as imported (handle without {@code @}, digits, or phone)
 * @param kind           identifier kind
 * @param resolvedId     numeric id once resolved, or {@code null}
 * @param resolvedHandle handle once resolved, or {@code null}
 * @param valid          whether the recipient is still eligible for delivery
 * @param errorReason    why the recipient was invalidated, or {@code null}
 */
public record Recipient(
    int position,
    String identifier,
    RecipientKind kind,
    Long resolvedId,
    String resolvedHandle,
    boolean valid,
    String errorReason
) {
  public Recipient {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(kind, "kind");
  }

  public static Recipient of(String identifier, RecipientKind kind) {
    return new Recipient(-1, identifier, kind, null, null, true, null);
  }

  /** Deduplication key: kind plus the lower-cased identifier. */
  public String dedupKey() {
    return kind.name() + ":" + identifier.toLowerCase(Locale.ROOT);
  }

  public Recipient atPosition(int position) {
    return new Recipient(position, identifier, kind, resolvedId, resolvedHandle, valid, errorReason);
  }

  public Recipient invalidate(String reason) {
    return new Recipient(position, identifier, kind, resolvedId, resolvedHandle, false, reason);
  }

  public Recipient resolved(Long id, String handle) {
    return new Recipient(position, identifier, kind, id, handle, valid, errorReason);
  }
}
