package bulkdispatch.memory;

import bulkdispatch.model.Recipient;
import bulkdispatch.model.RecipientKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses raw recipient lines.
 *
 * <ul>
 *   <li>blank lines and lines starting with {@code #} are ignored</li>
 *   <li>only digits: {@link RecipientKind#NUMERIC_ID}</li>
 *   <li>an optional {@code +} and 10 to 15 digits once spaces and dashes are removed:
 *       {@link RecipientKind#PHONE}, stored in that normalized form</li>
 *   <li>anything else: {@link RecipientKind#HANDLE} with a leading {@code @} removed</li>
 * </ul>
 */
public final class RecipientParser {
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern PHONE = Pattern.compile("\\+?\\d{10,15}");

  private RecipientParser() {}

  public static Optional<Recipient> parse(String line) {
    if (line == null) return Optional.empty();
    String value = line.strip();
    if (value.isEmpty() || value.startsWith("#")) {
      return Optional.empty();
    }
    if (DIGITS.matcher(value).matches()) {
      return Optional.of(Recipient.of(value, RecipientKind.NUMERIC_ID));
    }
    String compact = value.replace(" ", "").replace("-", "");
    if (PHONE.matcher(compact).matches()) {
      return Optional.of(Recipient.of(compact, RecipientKind.PHONE));
    }
    String handle = value.startsWith("@") ? value.substring(1) : value;
    if (handle.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(Recipient.of(handle, RecipientKind.HANDLE));
  }

  public static List<Recipient> parseAll(Collection<String> lines) {
    List<Recipient> result = new ArrayList<>();
    for (String line : lines) {
      parse(line).ifPresent(result::add);
    }
    return result;
  }
}
