package bulkdispatch.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Classified result of a single {@link Channel#deliver} call.
 */
public sealed interface DeliveryOutcome {

  /** Message accepted by the provider. */
  record Delivered() implements DeliveryOutcome {
  }

  /** Provider asked to back off for {@code retryAfter}; the same send is retried afterwards. */
  record Throttled(Duration retryAfter) implements DeliveryOutcome {
    public Throttled {
      Objects.requireNonNull(retryAfter, "retryAfter");
      if (retryAfter.isNegative()) {
        throw new IllegalArgumentException("retryAfter must not be negative");
      }
    }
  }

  /** The recipient permanently refuses messages (blocked, privacy restricted, deactivated...). */
  record Rejected(String reason) implements DeliveryOutcome {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /** The sending identity can no longer be used; the engine rotates to the next one. */
  record IdentityUnavailable(String reason) implements DeliveryOutcome {
    public IdentityUnavailable {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /** Any other failure. Counted as failed, never retried. */
  record Unclassified(String reason) implements DeliveryOutcome {
    public Unclassified {
      Objects.requireNonNull(reason, "reason");
    }
  }

  static DeliveryOutcome delivered() {
    return new Delivered();
  }

  static DeliveryOutcome throttled(Duration retryAfter) {
    return new Throttled(retryAfter);
  }

  static DeliveryOutcome rejected(String reason) {
    return new Rejected(reason);
  }
}
