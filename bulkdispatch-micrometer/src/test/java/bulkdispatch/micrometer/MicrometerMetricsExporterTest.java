package bulkdispatch.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDelivered();
    exporter.incrementDelivered();
    exporter.incrementFailed();
    exporter.incrementSkipped();
    exporter.incrementThrottled();

    assertEquals(2.0, counter("bulkdispatch.messages.delivered").count());
    assertEquals(1.0, counter("bulkdispatch.messages.failed").count());
    assertEquals(1.0, counter("bulkdispatch.recipients.skipped").count());
    assertEquals(1.0, counter("bulkdispatch.throttled").count());
  }

  @Test
  void jobLifecycleCounters() {
    exporter.incrementJobsStarted();
    exporter.incrementIdentitySwitches();
    exporter.incrementIdentitySwitches();
    exporter.incrementJobsFinished();

    assertEquals(1.0, counter("bulkdispatch.jobs.started").count());
    assertEquals(2.0, counter("bulkdispatch.identity.switches").count());
    assertEquals(1.0, counter("bulkdispatch.jobs.finished").count());
  }

  @Test
  void recordActiveJobs() {
    exporter.recordActiveJobs(3);
    assertEquals(3.0, gauge("bulkdispatch.jobs.active").value());

    exporter.recordActiveJobs(0);
    assertEquals(0.0, gauge("bulkdispatch.jobs.active").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "newsletter.dispatch");
    custom.incrementDelivered();
    custom.recordActiveJobs(2);

    assertEquals(1.0, counter("newsletter.dispatch.messages.delivered").count());
    assertEquals(2.0, gauge("newsletter.dispatch.jobs.active").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementDelivered();
    exporter.close();

    assertNull(registry.find("bulkdispatch.messages.delivered").counter());
    assertNull(registry.find("bulkdispatch.jobs.active").gauge());

    exporter.incrementDelivered();
    exporter.recordActiveJobs(5);
    assertNull(registry.find("bulkdispatch.messages.delivered").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
