package bulkdispatch.memory;

import bulkdispatch.model.RecipientKind;

import java.util.Map;

public record RecipientStats(int total, int valid, int invalid, Map<RecipientKind, Integer> byKind) {
  public RecipientStats {
    byKind = Map.copyOf(byKind);
  }
}
