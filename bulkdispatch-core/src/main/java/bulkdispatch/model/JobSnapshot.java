package bulkdispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable point-in-time copy of a {@link Job}, used for persistence, queries and
 * listener notifications.
 *
 * @param recipientCursor position of the last recipient whose outcome is final, or {@code -1}
 * @param identityCursor  index into the job's sendable identities currently in use
 * @param recipientLimit  set position the job stops before, fixed when it first starts;
 *                        {@code -1} while unset
 */
public record JobSnapshot(
    String id,
    String name,
    JobStatus status,
    String templateId,
    String recipientSetId,
    List<String> identityHandles,
    int total,
    int sent,
    int success,
    int failed,
    int skipped,
    int recipientCursor,
    int identityCursor,
    int recipientLimit,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant scheduledAt,
    List<ErrorEntry> errors
) {
  public JobSnapshot {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(templateId, "templateId");
    Objects.requireNonNull(recipientSetId, "recipientSetId");
    Objects.requireNonNull(createdAt, "createdAt");
    identityHandles = List.copyOf(identityHandles);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** Sent messages as a percentage of the total, {@code 0} when the total is unknown. */
  public double progressPercent() {
    if (total <= 0) return 0.0;
    return (sent * 100.0) / total;
  }

  /** Recipients whose outcome is final (sent or skipped). */
  public int processed() {
    return sent + skipped;
  }

  /** One-line human readable progress, e.g. {@code "40.0% | sent 4/10 | ok 3 | failed 1 | skipped 0"}. */
  public String progressText() {
    return String.format(java.util.Locale.ROOT, "%.1f%% | sent %d/%d | ok %d | failed %d | skipped %d",
        progressPercent(), sent, total, success, failed, skipped);
  }
}
