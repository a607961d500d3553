package bulkdispatch.memory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global set of identifiers that must never receive messages. Matching ignores case and a
 * leading {@code @}.
 *
 * <p>This class is thread-safe.
 */
public final class Blacklist {
  private final Set<String> entries = ConcurrentHashMap.newKeySet();

  public static String normalize(String identifier) {
    String value = identifier.strip().toLowerCase(Locale.ROOT);
    return value.startsWith("@") ? value.substring(1) : value;
  }

  /**
   * @return {@code true} if the identifier was not blacklisted before
   */
  public boolean add(String identifier) {
    return entries.add(normalize(identifier));
  }

  public boolean remove(String identifier) {
    return entries.remove(normalize(identifier));
  }

  public boolean contains(String identifier) {
    return identifier != null && entries.contains(normalize(identifier));
  }

  /**
   * @return number of entries removed
   */
  public int clear() {
    int removed = entries.size();
    entries.clear();
    return removed;
  }

  public int size() {
    return entries.size();
  }

  public List<String> entries() {
    return entries.stream().sorted().toList();
  }
}
