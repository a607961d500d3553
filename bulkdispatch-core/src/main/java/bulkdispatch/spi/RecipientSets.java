package bulkdispatch.spi;

import bulkdispatch.model.Recipient;

import java.util.Iterator;

/**
 * Access to imported recipient sets.
 *
 * <p>A set is read and written by at most one running job at a time. Callers that run two
 * jobs over the same set at once get no ordering guarantees.
 */
public interface RecipientSets {

  /**
   * Lazily iterates valid recipients of a set in position order, starting at
   * {@code fromPosition} (inclusive). Recipients invalidated while iterating are skipped.
   */
  Iterator<Recipient> validTargetsInOrder(String setId, int fromPosition);

  /**
   * Position one past the last recipient of the set, {@code 0} for an empty or unknown set.
   * A job fixes this bound when it first starts and never processes recipients at or beyond
   * it.
   */
  int endPosition(String setId);

  /** Valid recipients of the set. */
  default int countValid(String setId) {
    return countValid(setId, -1);
  }

  /**
   * Valid recipients positioned below {@code endPosition}; a negative bound counts the whole
   * set.
   */
  int countValid(String setId, int endPosition);

  void markInvalid(String setId, String identifier, String reason);

  boolean isBlacklisted(String identifier);
}
