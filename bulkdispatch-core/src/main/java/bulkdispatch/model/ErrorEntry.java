package bulkdispatch.model;

import java.time.Instant;
import java.util.Objects;

/** One entry in a job's ordered error log. */
public record ErrorEntry(String recipient, String reason, Instant occurredAt) {
  public ErrorEntry {
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }
}
