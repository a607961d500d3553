package bulkdispatch.model;

import java.util.Objects;

/** An existing channel message to forward verbatim instead of composing a new one. */
public record ForwardSource(String channel, long messageId) {
  public ForwardSource {
    Objects.requireNonNull(channel, "channel");
  }
}
