package bulkdispatch.memory;

/**
 * Outcome of importing recipient lines into a set.
 *
 * @param parsed  recipients recognised in the input
 * @param added   recipients actually appended (new and not blacklisted)
 */
public record ImportResult(String setId, int parsed, int added) {
  public int dropped() {
    return parsed - added;
  }
}
