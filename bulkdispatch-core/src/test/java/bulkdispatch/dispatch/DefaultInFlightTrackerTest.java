package bulkdispatch.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInFlightTrackerTest {

  @Test
  void acquireIsExclusivePerJob() {
    var tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("a"));
    assertFalse(tracker.tryAcquire("a"));
    assertTrue(tracker.tryAcquire("b"));
    assertTrue(tracker.isInFlight("a"));

    tracker.release("a");
    assertFalse(tracker.isInFlight("a"));
    assertTrue(tracker.tryAcquire("a"));
  }
}
