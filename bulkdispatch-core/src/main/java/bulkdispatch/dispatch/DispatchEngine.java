package bulkdispatch.dispatch;

import bulkdispatch.JobListener;
import bulkdispatch.model.Identity;
import bulkdispatch.model.Job;
import bulkdispatch.model.JobStatus;
import bulkdispatch.model.Recipient;
import bulkdispatch.model.Template;
import bulkdispatch.spi.AddressableTarget;
import bulkdispatch.spi.Channel;
import bulkdispatch.spi.ChannelUnavailableException;
import bulkdispatch.spi.DeliveryOutcome;
import bulkdispatch.spi.IdentityPool;
import bulkdispatch.spi.MetricsExporter;
import bulkdispatch.spi.RecipientSets;
import bulkdispatch.spi.RenderedContent;
import bulkdispatch.spi.TemplateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one job from {@code PENDING} or {@code PAUSED} to a terminal or paused state.
 *
 * <p>Recipients are processed strictly in order starting after the job's persisted cursor.
 * For each recipient the engine acquires a channel for the current identity, resolves the
 * recipient, checks the blacklist, renders the template and delivers it. The cursor is
 * advanced and checkpointed only once the recipient's outcome is final, so a job resumed
 * after a pause, cancellation race or process restart never skips work. A recipient may be
 * sent twice if the process dies between the send and the checkpoint.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>{@link DeliveryOutcome.Throttled} waits the exact provider duration and retries the
 *       same recipient with the same identity, without limit</li>
 *   <li>{@link DeliveryOutcome.Rejected} and {@link DeliveryOutcome.Unclassified} count as
 *       failed and are logged on the job</li>
 *   <li>{@link DeliveryOutcome.IdentityUnavailable} rotates to the next identity and retries
 *       the recipient; when every identity fails in a row the job fails</li>
 *   <li>an unresolvable recipient is skipped and marked invalid in its set</li>
 * </ul>
 *
 * <p>Every wait goes through the {@link Sleeper} and the job's {@link JobControl}, so cancel
 * interrupts pacing, identity switch and throttle waits promptly. Channels are released on
 * rotation and on every exit path.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; many jobs may execute
 * concurrently, but a given job id executes at most once at a time.
 *
 * @see JobControl
 * @see PacingPolicy
 */
public final class DispatchEngine {
  private static final Logger logger = Logger.getLogger(DispatchEngine.class.getName());

  static final String UNRESOLVABLE_REASON = "Could not resolve recipient";
  static final String JOB_SUBJECT = "job";

  private enum Step { SENT, SKIPPED, ABORTED }

  private final IdentityPool identityPool;
  private final RecipientSets recipientSets;
  private final TemplateStore templateStore;
  private final PacingPolicy pacing;
  private final Sleeper sleeper;
  private final JobCheckpoint checkpoint;
  private final JobListener listener;
  private final MetricsExporter metrics;
  private final InFlightTracker inFlightTracker;
  private final Clock clock;
  private final TemplateRenderer renderer;

  private DispatchEngine(Builder builder) {
    this.identityPool = Objects.requireNonNull(builder.identityPool, "identityPool");
    this.recipientSets = Objects.requireNonNull(builder.recipientSets, "recipientSets");
    this.templateStore = Objects.requireNonNull(builder.templateStore, "templateStore");
    this.pacing = builder.pacing != null ? builder.pacing : RandomPacingPolicy.defaults();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.CANCELLABLE;
    this.checkpoint = builder.checkpoint != null ? builder.checkpoint : JobCheckpoint.NONE;
    this.listener = builder.listener != null ? builder.listener : JobListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.renderer = new TemplateRenderer(clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Clock clock() {
    return clock;
  }

  /**
   * Executes the job with a fresh, never paused control.
   *
   * @see #execute(Job, JobControl)
   */
  public Job execute(Job job) {
    return execute(job, new JobControl(job, clock));
  }

  /**
   * Executes the job on the calling thread until it completes, fails, is cancelled or is
   * paused by an interrupt.
   *
   * <p>Returns the job unchanged when it is not {@code PENDING}/{@code PAUSED}, when the
   * control was aborted, or when another execution of the same job id is in flight.
   * Recipient-level errors never escape this method; job-level faults end the job as
   * {@code FAILED} with an error log entry.
   *
   * @param job     the job to execute
   * @param control the gate operators use to pause, resume and cancel this execution
   * @return the same job instance
   */
  public Job execute(Job job, JobControl control) {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(control, "control");
    if (control.job() != job) {
      throw new IllegalArgumentException("control belongs to another job");
    }
    if (control.isCancelled()) {
      logger.info("Job " + job.id() + " aborted before it started");
      return job;
    }
    JobStatus initial = job.status();
    if (!initial.isStartable()) {
      logger.warning("Job " + job.id() + " is " + initial + "; only PENDING or PAUSED jobs can run");
      return job;
    }
    if (!inFlightTracker.tryAcquire(job.id())) {
      logger.warning("Job " + job.id() + " is already executing; rejecting second execution");
      return job;
    }
    try {
      run(job, control);
    } finally {
      inFlightTracker.release(job.id());
    }
    return job;
  }

  private void run(Job job, JobControl control) {
    Optional<Template> template = templateStore.get(job.templateId());
    if (template.isEmpty()) {
      failBeforeStart(job, "Template not found: " + job.templateId());
      return;
    }
    List<Identity> identities = identityPool.listByHandles(job.identityHandles()).stream()
        .filter(Identity::canSend)
        .toList();
    if (identities.isEmpty()) {
      failBeforeStart(job, "No identity of " + job.identityHandles() + " can send");
      return;
    }
    boolean firstRun = job.startedAt() == null;
    int recipientLimit = firstRun
        ? recipientSets.endPosition(job.recipientSetId())
        : job.recipientLimit();
    int validRecipients = recipientSets.countValid(job.recipientSetId(), recipientLimit);
    if (validRecipients == 0) {
      failBeforeStart(job, "No valid recipients in set " + job.recipientSetId());
      return;
    }
    if (firstRun) {
      job.initTotal(validRecipients, recipientLimit);
    }
    if (!transition(job, JobStatus.RUNNING)) {
      logger.warning("Job " + job.id() + " could not enter RUNNING from " + job.status());
      return;
    }
    metrics.incrementJobsStarted();
    logger.info((firstRun ? "Started" : "Resumed") + " job " + job.id() + " (" + job.name()
        + ") with " + identities.size() + " identities at cursor " + job.recipientCursor());

    ExecutionContext ctx = new ExecutionContext(job, identities, identityPool);
    try {
      loop(job, control, template.get(), ctx);
      if (control.isReleased()) {
        logger.info("Job " + job.id() + " paused at cursor " + job.recipientCursor()
            + "; execution released");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (transition(job, JobStatus.PAUSED)) {
        logger.info("Job " + job.id() + " interrupted; paused at cursor " + job.recipientCursor());
      }
    } catch (IdentitiesExhaustedException e) {
      logger.severe("Job " + job.id() + " failed: " + e.getMessage());
      job.logError(JOB_SUBJECT, e.getMessage(), clock.instant());
      transition(job, JobStatus.FAILED);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Job " + job.id() + " failed with an internal error", e);
      job.logError(JOB_SUBJECT, "Internal error: " + e, clock.instant());
      transition(job, JobStatus.FAILED);
    } finally {
      ctx.releaseAll();
      checkpoint.save(job);
      if (job.status().isTerminal()) {
        metrics.incrementJobsFinished();
      }
    }
  }

  private void loop(Job job, JobControl control, Template template, ExecutionContext ctx)
      throws InterruptedException {
    Iterator<Recipient> recipients = new BoundedRecipients(
        recipientSets.validTargetsInOrder(job.recipientSetId(), job.recipientCursor() + 1),
        job.recipientLimit());
    while (true) {
      if (control.isCancelled()) break;
      if (!control.awaitIfPaused()) break;

      if (!recipients.hasNext()) {
        if (transition(job, JobStatus.COMPLETED)) {
          logger.info("Job " + job.id() + " completed: " + job.snapshot().progressText());
          break;
        }
        // paused or cancelled in the meantime; the gate decides what happens next
        continue;
      }

      Recipient recipient = recipients.next();
      Step step = process(job, control, template, ctx, recipient);
      if (step == Step.ABORTED) break;
      if (step == Step.SKIPPED) continue;

      boolean more = recipients.hasNext();
      if (ctx.recordSent() >= pacing.messagesPerIdentity()) {
        Duration delay = more ? pacing.identitySwitchDelay() : Duration.ZERO;
        switchIdentity(job, ctx, delay);
        if (more && !sleeper.sleep(delay, control)) break;
      } else if (more) {
        if (!sleeper.sleep(pacing.nextMessageDelay(), control)) break;
      }
    }
  }

  private Step process(Job job, JobControl control, Template template, ExecutionContext ctx,
      Recipient recipient) throws InterruptedException {
    while (true) {
      Identity identity = ctx.currentIdentity();
      Channel channel;
      Optional<AddressableTarget> target;
      try {
        channel = ctx.channel();
        target = resolve(channel, recipient);
      } catch (ChannelUnavailableException e) {
        identityUnavailable(job, ctx, e.getMessage());
        continue;
      }

      if (target.isEmpty()) {
        ctx.markAvailable();
        recipientSets.markInvalid(job.recipientSetId(), recipient.identifier(), UNRESOLVABLE_REASON);
        skip(job, recipient, UNRESOLVABLE_REASON);
        return Step.SKIPPED;
      }
      if (recipientSets.isBlacklisted(recipient.identifier())) {
        ctx.markAvailable();
        skip(job, recipient, "blacklisted");
        return Step.SKIPPED;
      }

      RenderedContent content = renderer.render(template, recipient, target.get());
      DeliveryOutcome outcome = deliver(job, control, identity, channel, target.get(), content, recipient);
      if (outcome == null) {
        return Step.ABORTED;
      }
      if (outcome instanceof DeliveryOutcome.IdentityUnavailable unavailable) {
        identityUnavailable(job, ctx, unavailable.reason());
        continue;
      }

      ctx.markAvailable();
      boolean success = outcome instanceof DeliveryOutcome.Delivered;
      if (success) {
        job.recordDelivered();
        metrics.incrementDelivered();
      } else {
        String reason = failureReason(outcome);
        job.recordFailed(recipient.identifier(), reason, clock.instant());
        metrics.incrementFailed();
        logger.fine("Job " + job.id() + ": delivery to " + recipient.identifier() + " failed: " + reason);
      }
      recordUsage(identity, success);
      commit(job, recipient);
      return Step.SENT;
    }
  }

  private Optional<AddressableTarget> resolve(Channel channel, Recipient recipient) {
    try {
      Optional<AddressableTarget> target = channel.resolve(recipient);
      return target != null ? target : Optional.empty();
    } catch (ChannelUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Resolving " + recipient.identifier() + " failed", e);
      return Optional.empty();
    }
  }

  /**
   * Delivers, waiting out throttles. Returns {@code null} if the job was cancelled while
   * waiting.
   */
  private DeliveryOutcome deliver(Job job, JobControl control, Identity identity, Channel channel,
      AddressableTarget target, RenderedContent content, Recipient recipient) throws InterruptedException {
    while (true) {
      DeliveryOutcome outcome;
      try {
        outcome = channel.deliver(target, content);
      } catch (ChannelUnavailableException e) {
        return new DeliveryOutcome.IdentityUnavailable(String.valueOf(e.getMessage()));
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Job " + job.id() + ": unexpected error delivering to "
            + recipient.identifier(), e);
        return new DeliveryOutcome.Unclassified(e.toString());
      }
      if (outcome == null) {
        return new DeliveryOutcome.Unclassified("Channel returned no outcome");
      }
      if (!(outcome instanceof DeliveryOutcome.Throttled throttled)) {
        return outcome;
      }
      Duration wait = throttled.retryAfter();
      metrics.incrementThrottled();
      logger.warning("Job " + job.id() + ": identity " + identity.handle() + " throttled; waiting "
          + wait.toSeconds() + "s before retrying " + recipient.identifier());
      fireSafely(() -> listener.onThrottled(job.id(), identity.handle(), recipient.identifier(), wait));
      if (!sleeper.sleep(wait, control)) {
        return null;
      }
    }
  }

  private void identityUnavailable(Job job, ExecutionContext ctx, String reason) {
    Identity current = ctx.currentIdentity();
    logger.warning("Job " + job.id() + ": identity " + current.handle() + " unavailable: " + reason);
    if (ctx.markUnavailable()) {
      throw new IdentitiesExhaustedException("All " + ctx.identityCount()
          + " identities unavailable; last error: " + reason);
    }
    switchIdentity(job, ctx, Duration.ZERO);
  }

  private void switchIdentity(Job job, ExecutionContext ctx, Duration delay) {
    String from = ctx.currentIdentity().handle();
    String to = ctx.rotate().handle();
    metrics.incrementIdentitySwitches();
    logger.fine("Job " + job.id() + ": switching identity " + from + " -> " + to);
    fireSafely(() -> listener.onIdentitySwitch(job.id(), from, to, delay));
  }

  private void skip(Job job, Recipient recipient, String reason) {
    job.recordSkipped();
    metrics.incrementSkipped();
    logger.fine("Job " + job.id() + ": skipped " + recipient.identifier() + " (" + reason + ")");
    commit(job, recipient);
  }

  private void commit(Job job, Recipient recipient) {
    job.advanceCursor(recipient.position());
    checkpoint.save(job);
    fireSafely(() -> listener.onProgress(job.snapshot()));
  }

  private void recordUsage(Identity identity, boolean success) {
    try {
      identityPool.recordUsage(identity.handle(), success);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record usage of identity " + identity.handle(), e);
    }
  }

  private void failBeforeStart(Job job, String reason) {
    logger.severe("Job " + job.id() + " cannot start: " + reason);
    job.logError(JOB_SUBJECT, reason, clock.instant());
    transition(job, JobStatus.FAILED);
    metrics.incrementJobsFinished();
  }

  private boolean transition(Job job, JobStatus next) {
    JobStatus previous = job.status();
    if (!job.transitionTo(next, clock.instant())) {
      return false;
    }
    checkpoint.save(job);
    fireSafely(() -> listener.onStatusChanged(job.snapshot(), previous));
    return true;
  }

  private static String failureReason(DeliveryOutcome outcome) {
    if (outcome instanceof DeliveryOutcome.Rejected rejected) {
      return rejected.reason();
    }
    if (outcome instanceof DeliveryOutcome.Unclassified unclassified) {
      return unclassified.reason();
    }
    return outcome.toString();
  }

  private static void fireSafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Job listener failed", e);
    }
  }

  /**
   * Valid recipients below the job's recipient limit; recipients appended to the set after
   * the first run started are not part of the job.
   */
  private static final class BoundedRecipients implements Iterator<Recipient> {
    private final Iterator<Recipient> delegate;
    private final int limit;
    private Recipient next;
    private boolean exhausted;

    BoundedRecipients(Iterator<Recipient> delegate, int limit) {
      this.delegate = delegate;
      this.limit = limit;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !exhausted) {
        if (delegate.hasNext()) {
          Recipient candidate = delegate.next();
          if (limit < 0 || candidate.position() < limit) {
            next = candidate;
          } else {
            exhausted = true;
          }
        } else {
          exhausted = true;
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

  /** Builder for {@link DispatchEngine}. */
  public static final class Builder {
    private IdentityPool identityPool;
    private RecipientSets recipientSets;
    private TemplateStore templateStore;
    private PacingPolicy pacing;
    private Sleeper sleeper;
    private JobCheckpoint checkpoint;
    private JobListener listener;
    private MetricsExporter metrics;
    private InFlightTracker inFlightTracker;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the source of sender identities and channels.
     *
     * <p><b>Required.</b>
     *
     * @param identityPool the identity pool
     * @return this builder
     */
    public Builder identityPool(IdentityPool identityPool) {
      this.identityPool = identityPool;
      return this;
    }

    /**
     * Sets the recipient sets jobs iterate over.
     *
     * <p><b>Required.</b>
     *
     * @param recipientSets the recipient sets
     * @return this builder
     */
    public Builder recipientSets(RecipientSets recipientSets) {
      this.recipientSets = recipientSets;
      return this;
    }

    /**
     * Sets the store templates are looked up in.
     *
     * <p><b>Required.</b>
     *
     * @param templateStore the template store
     * @return this builder
     */
    public Builder templateStore(TemplateStore templateStore) {
      this.templateStore = templateStore;
      return this;
    }

    /**
     * Sets message delays, identity switch delay and per-identity cap.
     *
     * <p>Optional. Defaults to {@link RandomPacingPolicy#defaults()}.
     *
     * @param pacing the pacing policy
     * @return this builder
     */
    public Builder pacing(PacingPolicy pacing) {
      this.pacing = pacing;
      return this;
    }

    /**
     * Optional. Defaults to {@link Sleeper#CANCELLABLE}.
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the callback that persists job state.
     *
     * <p>Optional. Defaults to {@link JobCheckpoint#NONE}.
     *
     * @param checkpoint the checkpoint callback
     * @return this builder
     */
    public Builder checkpoint(JobCheckpoint checkpoint) {
      this.checkpoint = checkpoint;
      return this;
    }

    /**
     * Optional. Defaults to {@link JobListener#NOOP}.
     *
     * @param listener the progress listener
     * @return this builder
     */
    public Builder listener(JobListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the per-job guard
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the clock used for timestamps and the {@code {date}}/{@code {time}} placeholders.
     *
     * <p>Optional. Defaults to {@link Clock#systemDefaultZone()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DispatchEngine build() {
      return new DispatchEngine(this);
    }
  }
}
