package bulkdispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable message template.
 *
 * <p>The content mode is derived: a forward source wins over media, media wins over plain text.
 * The text body may contain {@code {username}}, {@code {user_id}}, {@code {date}} and
 * {@code {time}} placeholders; in media mode it becomes the caption.
 */
public record Template(
    String id,
    String name,
    String text,
    MediaAttachment media,
    ForwardSource forward,
    List<LinkButton> buttons,
    Instant createdAt
) {
  public Template {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    buttons = buttons == null ? List.of() : List.copyOf(buttons);
    if (forward == null && media == null && (text == null || text.isEmpty())) {
      throw new IllegalArgumentException("Template " + id + " has no content");
    }
  }

  public static Template text(String id, String name, String text) {
    return new Template(id, name, text, null, null, List.of(), Instant.now());
  }

  public ContentMode mode() {
    if (forward != null) return ContentMode.FORWARD;
    if (media != null) return ContentMode.MEDIA;
    return ContentMode.TEXT;
  }
}
