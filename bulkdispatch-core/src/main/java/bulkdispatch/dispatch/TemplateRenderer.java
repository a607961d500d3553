package bulkdispatch.dispatch;

import bulkdispatch.model.Recipient;
import bulkdispatch.model.Template;
import bulkdispatch.spi.AddressableTarget;
import bulkdispatch.spi.RenderedContent;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link Template} into {@link RenderedContent} for one recipient.
 *
 * <p>Supported placeholders: {@code {username}}, {@code {user_id}}, {@code {date}}
 * ({@code yyyy-MM-dd}) and {@code {time}} ({@code HH:mm}), evaluated in the clock's zone.
 * Anything else in braces is left as is.
 */
public final class TemplateRenderer {
  static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  private final Clock clock;

  public TemplateRenderer(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RenderedContent render(Template template, Recipient recipient, AddressableTarget target) {
    return switch (template.mode()) {
      case FORWARD -> new RenderedContent.Forward(template.forward());
      case MEDIA -> new RenderedContent.Media(template.media(),
          template.text() == null ? null : renderText(template.text(), recipient, target),
          template.buttons());
      case TEXT -> new RenderedContent.Text(renderText(template.text(), recipient, target),
          template.buttons());
    };
  }

  public String renderText(String text, Recipient recipient, AddressableTarget target) {
    String result = text;
    for (Map.Entry<String, String> variable : variables(recipient, target).entrySet()) {
      result = result.replace("{" + variable.getKey() + "}", variable.getValue());
    }
    return result;
  }

  private Map<String, String> variables(Recipient recipient, AddressableTarget target) {
    ZonedDateTime now = ZonedDateTime.now(clock);
    Map<String, String> vars = new LinkedHashMap<>();
    vars.put("username", username(recipient, target));
    vars.put("user_id", String.valueOf(target.id()));
    vars.put("date", DATE_FORMAT.format(now));
    vars.put("time", TIME_FORMAT.format(now));
    return vars;
  }

  private static String username(Recipient recipient, AddressableTarget target) {
    if (target.handle() != null && !target.handle().isEmpty()) {
      return target.handle();
    }
    if (recipient.resolvedHandle() != null) {
      return recipient.resolvedHandle();
    }
    return recipient.identifier();
  }
}
