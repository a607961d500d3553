package bulkdispatch.micrometer;

import bulkdispatch.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code bulkdispatch.messages.delivered} - messages accepted by the provider</li>
 *   <li>{@code bulkdispatch.messages.failed} - permanent or unclassified delivery failures</li>
 *   <li>{@code bulkdispatch.recipients.skipped} - unresolvable or blacklisted recipients</li>
 *   <li>{@code bulkdispatch.throttled} - provider throttle responses</li>
 *   <li>{@code bulkdispatch.identity.switches} - identity rotations</li>
 *   <li>{@code bulkdispatch.jobs.started} - executions that reached RUNNING</li>
 *   <li>{@code bulkdispatch.jobs.finished} - executions that ended in a terminal status</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code bulkdispatch.jobs.active} - executions currently queued or running</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter delivered;
    private final Counter failed;
    private final Counter skipped;
    private final Counter throttled;
    private final Counter identitySwitches;
    private final Counter jobsStarted;
    private final Counter jobsFinished;
    private final Gauge activeJobsGauge;

    private final AtomicInteger activeJobs = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "bulkdispatch"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "bulkdispatch");
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "newsletter.dispatch"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.delivered = Counter.builder(namePrefix + ".messages.delivered")
                .description("Messages accepted by the provider")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".messages.failed")
                .description("Messages rejected or failed with an unclassified error")
                .register(registry);
        this.skipped = Counter.builder(namePrefix + ".recipients.skipped")
                .description("Recipients skipped as unresolvable or blacklisted")
                .register(registry);
        this.throttled = Counter.builder(namePrefix + ".throttled")
                .description("Throttle responses from the provider")
                .register(registry);
        this.identitySwitches = Counter.builder(namePrefix + ".identity.switches")
                .description("Sender identity rotations")
                .register(registry);
        this.jobsStarted = Counter.builder(namePrefix + ".jobs.started")
                .description("Job executions that reached RUNNING")
                .register(registry);
        this.jobsFinished = Counter.builder(namePrefix + ".jobs.finished")
                .description("Job executions that ended in a terminal status")
                .register(registry);

        this.activeJobsGauge = Gauge.builder(namePrefix + ".jobs.active", activeJobs, AtomicInteger::get)
                .description("Job executions currently queued or running")
                .register(registry);
    }

    @Override
    public void incrementDelivered() {
        if (closed) return;
        delivered.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementSkipped() {
        if (closed) return;
        skipped.increment();
    }

    @Override
    public void incrementThrottled() {
        if (closed) return;
        throttled.increment();
    }

    @Override
    public void incrementIdentitySwitches() {
        if (closed) return;
        identitySwitches.increment();
    }

    @Override
    public void incrementJobsStarted() {
        if (closed) return;
        jobsStarted.increment();
    }

    @Override
    public void incrementJobsFinished() {
        if (closed) return;
        jobsFinished.increment();
    }

    @Override
    public void recordActiveJobs(int activeJobs) {
        if (closed) return;
        this.activeJobs.set(activeJobs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the {@link bulkdispatch.JobManager} using it is closed so no stale
     * gauge keeps reporting.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(delivered, failed, skipped, throttled, identitySwitches,
                jobsStarted, jobsFinished, activeJobsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
