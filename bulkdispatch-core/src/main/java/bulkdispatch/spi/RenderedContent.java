package bulkdispatch.spi;

import bulkdispatch.model.ForwardSource;
import bulkdispatch.model.LinkButton;
import bulkdispatch.model.MediaAttachment;

import java.util.List;
import java.util.Objects;

/**
 * Message content ready to hand to a {@link Channel}: one variant per template content mode.
 */
public sealed interface RenderedContent {

  record Text(String text, List<LinkButton> buttons) implements RenderedContent {
    public Text {
      Objects.requireNonNull(text, "text");
      buttons = List.copyOf(buttons);
    }
  }

  /** Media message; {@code caption} is {@code null} when the template has no text. */
  record Media(MediaAttachment media, String caption, List<LinkButton> buttons) implements RenderedContent {
    public Media {
      Objects.requireNonNull(media, "media");
      buttons = List.copyOf(buttons);
    }
  }

  record Forward(ForwardSource source) implements RenderedContent {
    public Forward {
      Objects.requireNonNull(source, "source");
    }
  }
}
