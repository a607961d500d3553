package bulkdispatch.model;

import java.util.Objects;

/** Reference to a media file sent with the rendered text as caption. */
public record MediaAttachment(String reference, MediaType type) {
  public MediaAttachment {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(type, "type");
  }
}
