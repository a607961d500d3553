package bulkdispatch.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed in-flight tracker. A job id stays claimed until released.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Set<String> inflight = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryAcquire(String jobId) {
        return inflight.add(jobId);
    }

    @Override
    public void release(String jobId) {
        inflight.remove(jobId);
    }

    @Override
    public boolean isInFlight(String jobId) {
        return inflight.contains(jobId);
    }
}
