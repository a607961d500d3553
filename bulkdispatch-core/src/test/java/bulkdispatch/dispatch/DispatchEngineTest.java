package bulkdispatch.dispatch;

import bulkdispatch.JobListener;
import bulkdispatch.memory.InMemoryIdentityPool;
import bulkdispatch.memory.InMemoryRecipientSets;
import bulkdispatch.memory.InMemoryRoutePool;
import bulkdispatch.memory.InMemoryTemplateStore;
import bulkdispatch.model.ErrorEntry;
import bulkdispatch.model.Identity;
import bulkdispatch.model.IdentityStatus;
import bulkdispatch.model.Job;
import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;
import bulkdispatch.model.Recipient;
import bulkdispatch.model.Template;
import bulkdispatch.spi.DeliveryOutcome;
import bulkdispatch.spi.RenderedContent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DispatchEngineTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);

  private List<String> timeline;
  private ScriptedChannelFactory channels;
  private InMemoryRoutePool routes;
  private InMemoryIdentityPool identities;
  private InMemoryRecipientSets recipientSets;
  private InMemoryTemplateStore templates;
  private RecordingSleeper sleeper;
  private List<JobSnapshot> checkpoints;
  private List<String> events;

  @BeforeEach
  void setUp() {
    timeline = new CopyOnWriteArrayList<>();
    channels = new ScriptedChannelFactory(timeline);
    routes = new InMemoryRoutePool();
    identities = new InMemoryIdentityPool(channels, routes, CLOCK);
    identities.add(Identity.active("alice")).add(Identity.active("bob"));
    recipientSets = new InMemoryRecipientSets();
    templates = new InMemoryTemplateStore();
    templates.put(Template.text("tpl", "Greeting", "Hi {username}"));
    sleeper = new RecordingSleeper(timeline);
    checkpoints = new CopyOnWriteArrayList<>();
    events = new CopyOnWriteArrayList<>();
  }

  @Test
  void deliversEveryRecipientInOrderAndCompletes() {
    String set = recipients(3);
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(List.of("user1", "user2", "user3"), channels.deliveredRecipients());
    assertEquals(3, done.total());
    assertEquals(3, done.sent());
    assertEquals(3, done.success());
    assertEquals(2, done.recipientCursor());
    assertNotNull(done.startedAt());
    assertNotNull(done.completedAt());
    assertEquals(List.of(FixedPacing.MESSAGE_DELAY, FixedPacing.MESSAGE_DELAY), sleeper.sleeps);
    assertEquals(0, channels.openChannels.get());
    assertEquals(3, identities.get("alice").orElseThrow().sentCount());
  }

  @Test
  void rendersTemplatePerRecipient() {
    String set = recipients(1);
    engine(FixedPacing.cap(50)).execute(newJob(set, "alice"));

    RenderedContent content = channels.deliveries.get(0).content();
    var text = assertInstanceOf(RenderedContent.Text.class, content);
    assertEquals("Hi user1", text.text());
  }

  @Test
  void switchDelayHappensBetweenCapAndNextRecipient() {
    String set = recipients(10);
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(5)).execute(job);

    assertEquals(JobStatus.COMPLETED, job.status());
    int fifth = timeline.indexOf("deliver:alice:user5");
    int sixth = timeline.indexOf("deliver:alice:user6");
    int switchSleep = timeline.indexOf("sleep:" + FixedPacing.SWITCH_DELAY);
    assertTrue(fifth < switchSleep && switchSleep < sixth, timeline.toString());
    assertTrue(timeline.subList(fifth, sixth).contains("close:alice"));
    assertEquals(1, sleeper.sleeps.stream().filter(FixedPacing.SWITCH_DELAY::equals).count());
    assertTrue(events.contains("switch:alice->alice:" + FixedPacing.SWITCH_DELAY));
  }

  @Test
  void noIdentityExceedsCapBetweenSwitches() {
    String set = recipients(10);
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(3)).execute(job);

    List<String> senders = channels.deliveries.stream()
        .map(ScriptedChannelFactory.Delivery::identity)
        .toList();
    assertEquals(List.of("alice", "alice", "alice", "bob", "bob", "bob",
        "alice", "alice", "alice", "bob"), senders);
    assertEquals(0, channels.openChannels.get());
  }

  @Test
  void unresolvableRecipientIsSkippedAndInvalidated() {
    String set = recipients(5);
    channels.unresolvable("user3");
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(1, done.skipped());
    assertEquals(4, done.sent());
    assertEquals(List.of("user1", "user2", "user4", "user5"), channels.deliveredRecipients());
    Recipient third = recipientSets.list(set).get(2);
    assertFalse(third.valid());
    assertEquals(DispatchEngine.UNRESOLVABLE_REASON, third.errorReason());
    assertEquals(3, sleeper.sleeps.size());
  }

  @Test
  void blacklistedRecipientIsSkipped() {
    String set = recipients(3);
    recipientSets.blacklist().add("@User2");
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(List.of("user1", "user3"), channels.deliveredRecipients());
    assertEquals(1, job.snapshot().skipped());
    assertEquals(2, job.snapshot().recipientCursor());
  }

  @Test
  void throttleWaitsExactDurationAndRetriesSameRecipient() {
    String set = recipients(5);
    Duration wait = Duration.ofSeconds(30);
    channels.script("user4", DeliveryOutcome.throttled(wait));
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(List.of("user1", "user2", "user3", "user4", "user4", "user5"),
        channels.deliveredRecipients());
    int first = timeline.indexOf("deliver:alice:user4");
    int retry = timeline.lastIndexOf("deliver:alice:user4");
    assertEquals(List.of("sleep:" + wait), timeline.subList(first + 1, retry));
    assertEquals(5, job.snapshot().success());
    assertTrue(events.contains("throttled:alice:user4:" + wait));
  }

  @Test
  void rejectedAndUnclassifiedCountAsFailed() {
    String set = recipients(3);
    channels.script("user1", DeliveryOutcome.rejected("privacy restricted"));
    channels.script("user2", new DeliveryOutcome.Unclassified("socket reset"));
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(3, done.sent());
    assertEquals(1, done.success());
    assertEquals(2, done.failed());
    assertEquals(List.of("user1", "user2"),
        done.errors().stream().map(ErrorEntry::recipient).toList());
    assertEquals("privacy restricted", done.errors().get(0).reason());
    assertEquals(1, identities.get("alice").orElseThrow().sentCount());
    assertEquals(2, identities.get("alice").orElseThrow().errorCount());
  }

  @Test
  void channelExceptionIsUnclassifiedFailure() {
    String set = recipients(2);
    channels.onDeliver(d -> {
      if (d.recipient().equals("user1")) throw new IllegalStateException("boom");
    });
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(1, job.snapshot().failed());
    assertTrue(job.snapshot().errors().get(0).reason().contains("boom"));
  }

  @Test
  void unavailableIdentityRotatesAndRetriesRecipient() {
    String set = recipients(2);
    channels.script("user1", new DeliveryOutcome.IdentityUnavailable("session expired"));
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(List.of("alice:user1", "bob:user1", "bob:user2"), channels.deliveries.stream()
        .map(d -> d.identity() + ":" + d.recipient())
        .toList());
    assertEquals(2, job.snapshot().success());
    assertEquals(1, job.snapshot().identityCursor());
  }

  @Test
  void failsWhenEveryIdentityIsUnavailable() {
    String set = recipients(3);
    channels.broken("alice").broken("bob");
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.FAILED, done.status());
    assertEquals(0, done.sent());
    assertEquals(-1, done.recipientCursor());
    assertNotNull(done.completedAt());
    assertTrue(done.errors().get(0).reason().contains("identities unavailable"));
  }

  @Test
  void skippedRecipientResetsUnavailableCount() {
    String set = recipients(2);
    channels.brokenOnce("alice");
    channels.unresolvable("user1");
    channels.script("user2", new DeliveryOutcome.IdentityUnavailable("session expired"));
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(1, done.skipped());
    assertEquals(1, done.success());
    assertEquals(List.of("bob:user2", "alice:user2"), channels.deliveries.stream()
        .map(d -> d.identity() + ":" + d.recipient())
        .toList());
  }

  @Test
  void failsWhenEveryIdentityRejectsTheSameRecipient() {
    String set = recipients(2);
    channels.script("user1", new DeliveryOutcome.IdentityUnavailable("flood"),
        new DeliveryOutcome.IdentityUnavailable("flood"), new DeliveryOutcome.IdentityUnavailable("flood"));
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals(List.of("alice:user1", "bob:user1"), channels.deliveries.stream()
        .map(d -> d.identity() + ":" + d.recipient())
        .toList());
    assertEquals(-1, job.recipientCursor());
  }

  @Test
  void failsWithoutTemplate() {
    String set = recipients(1);
    Job job = Job.create("j1", "Job", "missing", set, List.of("alice"), CLOCK.instant(), null);

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Template not found: missing", job.snapshot().errors().get(0).reason());
    assertTrue(channels.deliveries.isEmpty());
  }

  @Test
  void failsWithoutSendableIdentity() {
    String set = recipients(1);
    identities.add(Identity.active("carol").withStatus(IdentityStatus.RESTRICTED, false));
    Job job = newJob(set, "carol", "unknown");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.FAILED, job.status());
    assertTrue(job.snapshot().errors().get(0).reason().startsWith("No identity"));
  }

  @Test
  void failsWithEmptyRecipientSet() {
    String set = recipientSets.createSet();
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals(0, job.snapshot().total());
  }

  @Test
  void cancelWhilePausedEndsWithoutFurtherSends() throws Exception {
    String set = recipients(5);
    Job job = newJob(set, "alice");
    JobControl control = new JobControl(job, CLOCK);
    CountDownLatch paused = new CountDownLatch(1);
    channels.onDeliver(d -> {
      if (d.recipient().equals("user2")) {
        assertTrue(control.pause());
        paused.countDown();
      }
    });
    DispatchEngine engine = engine(FixedPacing.cap(50));

    Thread worker = new Thread(() -> engine.execute(job, control));
    worker.start();
    assertTrue(paused.await(5, TimeUnit.SECONDS));
    assertTrue(control.cancel());
    worker.join(5000);

    assertFalse(worker.isAlive());
    assertEquals(JobStatus.CANCELLED, job.status());
    assertEquals(List.of("user1", "user2"), channels.deliveredRecipients());
    assertEquals(1, job.snapshot().recipientCursor());
    assertEquals(0, channels.openChannels.get());
    assertNotNull(job.snapshot().completedAt());
  }

  @Test
  void pausedJobResumesThroughGate() throws Exception {
    String set = recipients(4);
    Job job = newJob(set, "alice");
    JobControl control = new JobControl(job, CLOCK);
    CountDownLatch paused = new CountDownLatch(1);
    channels.onDeliver(d -> {
      if (d.recipient().equals("user1")) {
        control.pause();
        paused.countDown();
      }
    });
    DispatchEngine engine = engine(FixedPacing.cap(50));

    Thread worker = new Thread(() -> engine.execute(job, control));
    worker.start();
    assertTrue(paused.await(5, TimeUnit.SECONDS));
    assertFalse(control.pause(), "pausing a paused job is rejected");
    assertTrue(control.resume());
    assertFalse(control.resume(), "resuming a running job is rejected");
    worker.join(5000);

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(List.of("user1", "user2", "user3", "user4"), channels.deliveredRecipients());
  }

  @Test
  void interruptedJobResumesFromCursorWithoutDuplicates() {
    String set = recipients(5);
    Job job = newJob(set, "alice", "bob");
    channels.onDeliver(d -> {
      if (d.recipient().equals("user3")) Thread.currentThread().interrupt();
    });
    Sleeper interruptible = (duration, control) -> {
      if (Thread.interrupted()) throw new InterruptedException();
      return !control.isCancelled();
    };
    DispatchEngine engine = builder(FixedPacing.cap(2)).sleeper(interruptible).build();

    engine.execute(job);
    assertTrue(Thread.interrupted(), "interrupt status is restored");
    assertEquals(JobStatus.PAUSED, job.status());
    assertEquals(2, job.recipientCursor());

    channels.onDeliver(d -> { });
    Job resumed = Job.restore(job.snapshot());
    engine.execute(resumed);

    assertEquals(JobStatus.COMPLETED, resumed.status());
    assertEquals(List.of("user1", "user2", "user3", "user4", "user5"), channels.deliveredRecipients());
    assertEquals(5, resumed.snapshot().sent());
    assertEquals(5, resumed.snapshot().total());

    int previous = -1;
    for (JobSnapshot checkpoint : checkpoints) {
      if (!checkpoint.id().equals(job.id())) continue;
      assertTrue(checkpoint.recipientCursor() >= previous, "cursor went backwards");
      previous = checkpoint.recipientCursor();
    }
  }

  @Test
  void recipientsAddedDuringRunAreNotSent() {
    String set = recipients(2);
    channels.onDeliver(d -> {
      if (d.recipient().equals("user1")) recipientSets.importLines(set, List.of("@late1", "@late2"));
    });
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(List.of("user1", "user2"), channels.deliveredRecipients());
    assertEquals(2, done.total());
    assertEquals(2, done.sent());
    assertEquals(2, done.recipientLimit());
    for (JobSnapshot s : checkpoints) {
      assertTrue(s.sent() + s.skipped() <= s.total(), s.toString());
    }
  }

  @Test
  void resumedJobKeepsRecipientScopeOfFirstRun() {
    String set = recipients(3);
    Job job = newJob(set, "alice");
    Sleeper interruptOnce = (duration, control) -> {
      throw new InterruptedException();
    };

    builder(FixedPacing.cap(50)).sleeper(interruptOnce).build().execute(job);
    Thread.interrupted();
    assertEquals(JobStatus.PAUSED, job.status());
    assertEquals(0, job.recipientCursor());
    assertEquals(3, job.recipientLimit());

    recipientSets.importLines(set, List.of("@late1", "@late2"));
    Job resumed = Job.restore(job.snapshot());
    engine(FixedPacing.cap(50)).execute(resumed);

    JobSnapshot done = resumed.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(List.of("user1", "user2", "user3"), channels.deliveredRecipients());
    assertEquals(3, done.total());
    assertEquals(3, done.sent());
  }

  @Test
  void pauseReleasesExecutionWhenRequested() {
    String set = recipients(4);
    Job job = newJob(set, "alice");
    JobControl control = new JobControl(job, CLOCK, true);
    channels.onDeliver(d -> {
      if (d.recipient().equals("user2")) assertTrue(control.pause());
    });
    DispatchEngine engine = engine(FixedPacing.cap(50));

    engine.execute(job, control);

    assertEquals(JobStatus.PAUSED, job.status());
    assertTrue(control.isReleased());
    assertFalse(control.resume(), "a released execution cannot be resumed");
    assertEquals(1, job.recipientCursor());
    assertEquals(0, channels.openChannels.get());
    assertEquals(JobStatus.PAUSED, checkpoints.get(checkpoints.size() - 1).status());

    channels.onDeliver(d -> { });
    engine.execute(job, new JobControl(job, CLOCK, true));

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(List.of("user1", "user2", "user3", "user4"), channels.deliveredRecipients());
    assertEquals(4, job.snapshot().sent());
  }

  @Test
  void countersAreConservedAtEveryCheckpoint() {
    String set = recipients(8);
    channels.unresolvable("user2");
    channels.script("user4", DeliveryOutcome.rejected("blocked"));
    channels.script("user5", DeliveryOutcome.throttled(Duration.ofSeconds(3)));
    channels.script("user6", new DeliveryOutcome.IdentityUnavailable("flood"));
    Job job = newJob(set, "alice", "bob");

    engine(FixedPacing.cap(2)).execute(job);

    assertFalse(checkpoints.isEmpty());
    for (JobSnapshot s : checkpoints) {
      assertEquals(s.sent(), s.success() + s.failed(), s.toString());
      assertTrue(s.sent() + s.skipped() <= s.total(), s.toString());
    }
    JobSnapshot done = job.snapshot();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(8, done.sent() + done.skipped());
  }

  @Test
  void secondExecutionOfSameJobIsRejected() {
    String set = recipients(2);
    Job job = newJob(set, "alice");
    InFlightTracker tracker = new DefaultInFlightTracker();
    assertTrue(tracker.tryAcquire(job.id()));

    builder(FixedPacing.cap(50)).inFlightTracker(tracker).build().execute(job);

    assertEquals(JobStatus.PENDING, job.status());
    assertTrue(channels.deliveries.isEmpty());
  }

  @Test
  void terminalJobIsNotExecuted() {
    String set = recipients(2);
    Job job = newJob(set, "alice");
    engine(FixedPacing.cap(50)).execute(job);
    int deliveries = channels.deliveries.size();

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(deliveries, channels.deliveries.size());
  }

  @Test
  void controlOfAnotherJobIsRejected() {
    String set = recipients(1);
    Job job = newJob(set, "alice");
    Job other = newJob(set, "alice");

    assertThrows(IllegalArgumentException.class,
        () -> engine(FixedPacing.cap(50)).execute(job, new JobControl(other, CLOCK)));
  }

  @Test
  void failingListenerDoesNotStopJob() {
    String set = recipients(3);
    Job job = newJob(set, "alice");
    JobListener failing = new JobListener() {
      @Override
      public void onProgress(JobSnapshot snapshot) {
        throw new IllegalStateException("listener down");
      }
    };

    builder(FixedPacing.cap(50)).listener(failing).build().execute(job);

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(3, job.snapshot().success());
  }

  @Test
  void statusChangesAreReported() {
    String set = recipients(1);
    Job job = newJob(set, "alice");

    engine(FixedPacing.cap(50)).execute(job);

    assertEquals(List.of("status:PENDING->RUNNING", "status:RUNNING->COMPLETED"),
        events.stream().filter(e -> e.startsWith("status:")).toList());
  }

  private String recipients(int count) {
    String set = recipientSets.createSet();
    recipientSets.importLines(set, IntStream.rangeClosed(1, count)
        .mapToObj(i -> "@user" + i)
        .collect(Collectors.toList()));
    return set;
  }

  private Job newJob(String set, String... handles) {
    return Job.create("job-" + checkpoints.size() + "-" + System.nanoTime(), "Job", "tpl", set,
        List.of(handles), CLOCK.instant(), null);
  }

  private DispatchEngine engine(PacingPolicy pacing) {
    return builder(pacing).build();
  }

  private DispatchEngine.Builder builder(PacingPolicy pacing) {
    return DispatchEngine.builder()
        .identityPool(identities)
        .recipientSets(recipientSets)
        .templateStore(templates)
        .pacing(pacing)
        .sleeper(sleeper)
        .checkpoint(job -> checkpoints.add(job.snapshot()))
        .listener(new JobListener() {
          @Override
          public void onStatusChanged(JobSnapshot job, JobStatus previous) {
            events.add("status:" + previous + "->" + job.status());
          }

          @Override
          public void onIdentitySwitch(String jobId, String from, String to, Duration delay) {
            events.add("switch:" + from + "->" + to + ":" + delay);
          }

          @Override
          public void onThrottled(String jobId, String identity, String recipient, Duration wait) {
            events.add("throttled:" + identity + ":" + recipient + ":" + wait);
          }
        })
        .clock(CLOCK);
  }
}
