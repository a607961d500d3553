package bulkdispatch.spi;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages accepted by the provider.
     */
    void incrementDelivered();

    /**
     * Increments the count of messages that failed permanently or unclassified.
     */
    void incrementFailed();

    /**
     * Increments the count of recipients skipped (unresolvable or blacklisted).
     */
    void incrementSkipped();

    /**
     * Increments the count of provider throttle responses.
     */
    void incrementThrottled();

    /**
     * Increments the count of identity rotations (cap reached or identity unavailable).
     */
    void incrementIdentitySwitches();

    void incrementJobsStarted();

    void incrementJobsFinished();

    /**
     * Records the number of job executions currently registered (queued or running).
     */
    void recordActiveJobs(int activeJobs);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementSkipped() {
        }

        @Override
        public void incrementThrottled() {
        }

        @Override
        public void incrementIdentitySwitches() {
        }

        @Override
        public void incrementJobsStarted() {
        }

        @Override
        public void incrementJobsFinished() {
        }

        @Override
        public void recordActiveJobs(int activeJobs) {
        }
    }
}
