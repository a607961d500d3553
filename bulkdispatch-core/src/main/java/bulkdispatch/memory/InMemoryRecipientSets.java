package bulkdispatch.memory;

import bulkdispatch.model.Recipient;
import bulkdispatch.model.RecipientKind;
import bulkdispatch.spi.RecipientSets;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * In-memory {@link RecipientSets}. Each set is an append-only list; a recipient's position is
 * its index. Imports are deduplicated on {@link Recipient#dedupKey()} and filtered through the
 * {@link Blacklist}.
 *
 * <p>Iterators read the live list, so recipients invalidated after an iterator was created
 * (for example by {@link #blacklist(String)}) are skipped.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryRecipientSets implements RecipientSets {
  private static final Logger logger = Logger.getLogger(InMemoryRecipientSets.class.getName());

  static final String BLACKLISTED_REASON = "Blacklisted";

  private final Blacklist blacklist;
  private final Map<String, RecipientSet> sets = new ConcurrentHashMap<>();

  public InMemoryRecipientSets() {
    this(new Blacklist());
  }

  public InMemoryRecipientSets(Blacklist blacklist) {
    this.blacklist = Objects.requireNonNull(blacklist, "blacklist");
  }

  public Blacklist blacklist() {
    return blacklist;
  }

  /** Creates an empty set with a generated id. */
  public String createSet() {
    String setId = UUID.randomUUID().toString();
    sets.put(setId, new RecipientSet());
    return setId;
  }

  /** Parses, deduplicates and appends raw lines to a set, creating the set if needed. */
  public ImportResult importLines(String setId, Collection<String> lines) {
    return importRecipients(setId, RecipientParser.parseAll(lines));
  }

  public ImportResult importRecipients(String setId, List<Recipient> recipients) {
    Objects.requireNonNull(setId, "setId");
    RecipientSet set = sets.computeIfAbsent(setId, id -> new RecipientSet());
    int added = 0;
    synchronized (set) {
      for (Recipient recipient : recipients) {
        if (blacklist.contains(recipient.identifier())) continue;
        if (!set.keys.add(recipient.dedupKey())) continue;
        set.recipients.add(recipient.atPosition(set.recipients.size()));
        added++;
      }
    }
    logger.info("Imported " + added + " of " + recipients.size() + " recipients into set " + setId);
    return new ImportResult(setId, recipients.size(), added);
  }

  public List<Recipient> list(String setId) {
    return List.copyOf(require(setId).recipients);
  }

  public boolean deleteSet(String setId) {
    return sets.remove(setId) != null;
  }

  public RecipientStats stats(String setId) {
    Map<RecipientKind, Integer> byKind = new EnumMap<>(RecipientKind.class);
    int valid = 0;
    List<Recipient> snapshot = List.copyOf(require(setId).recipients);
    for (Recipient r : snapshot) {
      byKind.merge(r.kind(), 1, Integer::sum);
      if (r.valid()) valid++;
    }
    return new RecipientStats(snapshot.size(), valid, snapshot.size() - valid, byKind);
  }

  /**
   * Adds an identifier to the blacklist and invalidates matching recipients in every set.
   *
   * @return {@code true} if the identifier was newly blacklisted
   */
  public boolean blacklist(String identifier) {
    boolean added = blacklist.add(identifier);
    String key = Blacklist.normalize(identifier);
    for (RecipientSet set : sets.values()) {
      synchronized (set) {
        for (int i = 0; i < set.recipients.size(); i++) {
          Recipient r = set.recipients.get(i);
          if (r.valid() && Blacklist.normalize(r.identifier()).equals(key)) {
            set.recipients.set(i, r.invalidate(BLACKLISTED_REASON));
          }
        }
      }
    }
    return added;
  }

  @Override
  public Iterator<Recipient> validTargetsInOrder(String setId, int fromPosition) {
    return new ValidIterator(require(setId).recipients, Math.max(0, fromPosition));
  }

  @Override
  public int endPosition(String setId) {
    RecipientSet set = sets.get(setId);
    return set == null ? 0 : set.recipients.size();
  }

  @Override
  public int countValid(String setId, int endPosition) {
    RecipientSet set = sets.get(setId);
    if (set == null) return 0;
    int count = 0;
    for (Recipient r : set.recipients) {
      if (endPosition >= 0 && r.position() >= endPosition) break;
      if (r.valid()) count++;
    }
    return count;
  }

  @Override
  public void markInvalid(String setId, String identifier, String reason) {
    RecipientSet set = require(setId);
    synchronized (set) {
      for (int i = 0; i < set.recipients.size(); i++) {
        Recipient r = set.recipients.get(i);
        if (r.identifier().equalsIgnoreCase(identifier)) {
          set.recipients.set(i, r.invalidate(reason));
        }
      }
    }
  }

  @Override
  public boolean isBlacklisted(String identifier) {
    return blacklist.contains(identifier);
  }

  private RecipientSet require(String setId) {
    RecipientSet set = sets.get(setId);
    if (set == null) {
      throw new IllegalArgumentException("Unknown recipient set: " + setId);
    }
    return set;
  }

  private static final class RecipientSet {
    final List<Recipient> recipients = new CopyOnWriteArrayList<>();
    final Set<String> keys = new HashSet<>();
  }

  private static final class ValidIterator implements Iterator<Recipient> {
    private final List<Recipient> recipients;
    private int index;
    private Recipient next;

    ValidIterator(List<Recipient> recipients, int fromPosition) {
      this.recipients = recipients;
      this.index = fromPosition;
    }

    @Override
    public boolean hasNext() {
      while (next == null && index < recipients.size()) {
        Recipient candidate = recipients.get(index++);
        if (candidate.valid()) {
          next = candidate;
        }
      }
      return next != null;
    }

    @Override
    public Recipient next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Recipient result = next;
      next = null;
      return result;
    }
  }
}
