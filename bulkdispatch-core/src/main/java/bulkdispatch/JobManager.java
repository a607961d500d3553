package bulkdispatch;

import bulkdispatch.dispatch.DispatchEngine;
import bulkdispatch.dispatch.JobControl;
import bulkdispatch.dispatch.PacingPolicy;
import bulkdispatch.dispatch.RandomPacingPolicy;
import bulkdispatch.dispatch.Sleeper;
import bulkdispatch.model.Job;
import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;
import bulkdispatch.registry.ActiveJobRegistry;
import bulkdispatch.registry.ActiveJobRegistry.Execution;
import bulkdispatch.schedule.JobScheduler;
import bulkdispatch.spi.ConnectionProvider;
import bulkdispatch.spi.IdentityPool;
import bulkdispatch.spi.JobStore;
import bulkdispatch.spi.JobStoreException;
import bulkdispatch.spi.MetricsExporter;
import bulkdispatch.spi.RecipientSets;
import bulkdispatch.spi.TemplateStore;
import bulkdispatch.util.DaemonThreadFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator-facing job lifecycle: create, start, pause, resume, cancel, delete, report and
 * query jobs.
 *
 * <p>The manager owns the durability boundary. Every status transition and every cursor
 * advance is written through the {@link JobStore}, so a job paused by a shutdown or left
 * {@code RUNNING} by a crash can be resumed from its cursor by a new manager after
 * {@link #recover()}.
 *
 * <p>At most {@code maxConcurrentJobs} executions run at once; {@link #start} is rejected
 * while all of them are taken. A paused job gives its worker back: its execution ends with the
 * cursor persisted and {@link #resume} starts a new execution from there. Scheduled jobs stay
 * {@code PENDING} until their timer fires; a timer that finds every worker busy tries again
 * after {@value #BUSY_RETRY_SECONDS} seconds.
 *
 * <p>Control operations return {@code false} and log a warning when the job is unknown or in
 * the wrong state; they never throw for that reason.
 *
 * <pre>{@code
 * try (JobManager manager = JobManager.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .jobStore(JdbcJobStores.detect(dataSource))
 *     .identityPool(identities)
 *     .recipientSets(recipients)
 *     .templateStore(templates)
 *     .build()) {
 *   manager.recover();
 *   JobSnapshot job = manager.create("spring sale", "tpl-1", setId, List.of("alice", "bob"));
 *   manager.start(job.id());
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobManager.class.getName());

  static final String RESTART_REASON = "Interrupted by process restart";
  static final int BUSY_RETRY_SECONDS = 30;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final DispatchEngine engine;
  private final ActiveJobRegistry registry = new ActiveJobRegistry();
  private final JobScheduler scheduler;
  private final ExecutorService workers;
  private final Semaphore slots;
  private final int maxConcurrentJobs;
  private final JobListeners listeners = new JobListeners();
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration drainTimeout;
  private volatile boolean closed;

  private JobManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    if (builder.maxConcurrentJobs < 1) {
      throw new IllegalArgumentException("maxConcurrentJobs must be >= 1");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
    builder.listeners.forEach(listeners::add);

    this.engine = DispatchEngine.builder()
        .identityPool(Objects.requireNonNull(builder.identityPool, "identityPool"))
        .recipientSets(Objects.requireNonNull(builder.recipientSets, "recipientSets"))
        .templateStore(Objects.requireNonNull(builder.templateStore, "templateStore"))
        .pacing(builder.pacing != null ? builder.pacing : RandomPacingPolicy.defaults())
        .sleeper(builder.sleeper)
        .checkpoint(this::persist)
        .listener(listeners)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.scheduler = new JobScheduler(clock);
    this.maxConcurrentJobs = builder.maxConcurrentJobs;
    this.slots = new Semaphore(maxConcurrentJobs);
    this.workers = Executors.newFixedThreadPool(maxConcurrentJobs,
        new DaemonThreadFactory("bulkdispatch-job-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Creation ──

  public JobSnapshot create(String name, String templateId, String recipientSetId,
      List<String> identityHandles) {
    return create(name, templateId, recipientSetId, identityHandles, null);
  }

  /**
   * Creates and persists a {@code PENDING} job. When {@code scheduledAt} is in the future a
   * timer starts the job at that instant; otherwise the job waits for {@link #start}.
   *
   * @throws JobStoreException if the job cannot be persisted
   */
  public JobSnapshot create(String name, String templateId, String recipientSetId,
      List<String> identityHandles, Instant scheduledAt) {
    ensureOpen();
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(templateId, "templateId");
    Objects.requireNonNull(recipientSetId, "recipientSetId");
    Job job = Job.create(UUID.randomUUID().toString(), name, templateId, recipientSetId,
        identityHandles, clock.instant(), scheduledAt);
    JobSnapshot snapshot = job.snapshot();
    inTransaction("insert job " + job.id(), conn -> {
      jobStore.insert(conn, snapshot);
      return null;
    });
    logger.info("Created job " + job.id() + " (" + name + ") for set " + recipientSetId
        + " with " + identityHandles.size() + " identities");
    if (scheduledAt != null && scheduledAt.isAfter(clock.instant())) {
      scheduler.schedule(job.id(), scheduledAt, () -> startScheduled(job.id()));
    }
    return snapshot;
  }

  // ── Control ──

  /**
   * Starts a {@code PENDING} or {@code PAUSED} job without blocking. Starting a job paused
   * by {@link #pause} while its execution is still alive resumes it.
   *
   * @return {@code true} if the job was handed to a worker or resumed; {@code false} if it is
   *     unknown, not startable, or every worker is busy
   */
  public boolean start(String jobId) {
    if (closed) {
      logger.warning("Manager closed; cannot start job " + jobId);
      return false;
    }
    Optional<Execution> active = registry.get(jobId);
    if (active.isPresent()) {
      if (active.get().control().isPaused()) {
        return resume(jobId);
      }
      logger.warning("Job " + jobId + " is already active");
      return false;
    }
    Optional<JobSnapshot> stored = load(jobId);
    if (stored.isEmpty()) {
      logger.warning("Cannot start unknown job " + jobId);
      return false;
    }
    if (!stored.get().status().isStartable()) {
      logger.warning("Cannot start job " + jobId + " in status " + stored.get().status());
      return false;
    }
    if (!slots.tryAcquire()) {
      logger.warning("Cannot start job " + jobId + ": all " + maxConcurrentJobs + " workers are busy");
      return false;
    }
    Job job = Job.restore(stored.get());
    Optional<Execution> registered = registry.register(job, new JobControl(job, clock, true));
    if (registered.isEmpty()) {
      slots.release();
      logger.warning("Job " + jobId + " was started concurrently");
      return false;
    }
    Execution execution = registered.get();
    scheduler.cancel(jobId);
    try {
      workers.execute(() -> runExecution(execution));
    } catch (RejectedExecutionException e) {
      slots.release();
      registry.remove(execution);
      logger.log(Level.WARNING, "Workers rejected job " + jobId, e);
      return false;
    }
    metrics.recordActiveJobs(registry.size());
    return true;
  }

  /**
   * Pauses a running job. The send in progress, if any, finishes first; then the execution
   * ends and frees its worker.
   */
  public boolean pause(String jobId) {
    Optional<Execution> active = registry.get(jobId);
    if (active.isEmpty()) {
      logger.warning("Cannot pause job " + jobId + ": not running");
      return false;
    }
    Job job = active.get().job();
    JobStatus previous = job.status();
    if (!active.get().control().pause()) {
      logger.warning("Cannot pause job " + jobId + " in status " + previous);
      return false;
    }
    afterOperatorTransition(job, previous);
    logger.info("Paused job " + jobId + " at cursor " + job.recipientCursor());
    return true;
  }

  /**
   * Resumes a paused job: reopens the gate of an execution that has not stopped yet, or
   * starts a new execution from the persisted cursor.
   *
   * @return {@code false} if the job is not paused or no worker is free
   */
  public boolean resume(String jobId) {
    Optional<Execution> active = registry.get(jobId);
    if (active.isPresent() && active.get().control().isReleased()) {
      awaitStopped(active.get());
      active = registry.get(jobId);
    }
    if (active.isEmpty()) {
      Optional<JobSnapshot> stored = load(jobId);
      if (stored.isPresent() && stored.get().status() == JobStatus.PAUSED) {
        return start(jobId);
      }
      logger.warning("Cannot resume job " + jobId + ": not paused");
      return false;
    }
    Job job = active.get().job();
    JobStatus previous = job.status();
    if (!active.get().control().resume()) {
      if (active.get().control().isReleased()) {
        awaitStopped(active.get());
        return !registry.isActive(jobId) && start(jobId);
      }
      logger.warning("Cannot resume job " + jobId + " in status " + previous);
      return false;
    }
    afterOperatorTransition(job, previous);
    logger.info("Resumed job " + jobId);
    return true;
  }

  /**
   * Cancels a {@code RUNNING} or {@code PAUSED} job. No further recipient is processed and
   * the job's channels are released.
   */
  public boolean cancel(String jobId) {
    Optional<Execution> active = registry.get(jobId);
    if (active.isPresent()) {
      Job job = active.get().job();
      JobStatus previous = job.status();
      if (!active.get().control().cancel()) {
        logger.warning("Cannot cancel job " + jobId + " in status " + previous);
        return false;
      }
      afterOperatorTransition(job, previous);
      logger.info("Cancelled job " + jobId);
      return true;
    }
    Optional<JobSnapshot> stored = load(jobId);
    if (stored.isEmpty()) {
      logger.warning("Cannot cancel unknown job " + jobId);
      return false;
    }
    Job job = Job.restore(stored.get());
    JobStatus previous = job.status();
    if (!job.transitionTo(JobStatus.CANCELLED, clock.instant())) {
      logger.warning("Cannot cancel job " + jobId + " in status " + previous);
      return false;
    }
    scheduler.cancel(jobId);
    afterOperatorTransition(job, previous);
    logger.info("Cancelled job " + jobId);
    return true;
  }

  /**
   * Deletes a job, cancelling it first if it is active. Waits up to the drain timeout for the
   * execution to wind down before removing the record.
   *
   * @return {@code true} if a job record was removed
   */
  public boolean delete(String jobId) {
    scheduler.cancel(jobId);
    Optional<Execution> active = registry.get(jobId);
    if (active.isPresent()) {
      JobControl control = active.get().control();
      if (!control.cancel()) {
        control.abort();
      }
      try {
        if (!active.get().awaitDone(drainTimeout)) {
          logger.warning("Job " + jobId + " did not stop within " + drainTimeout + "; deleting anyway");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    boolean removed = inTransaction("delete job " + jobId, conn -> jobStore.delete(conn, jobId));
    listeners.removeJob(jobId);
    if (removed) {
      logger.info("Deleted job " + jobId);
    }
    return removed;
  }

  // ── Reports & queries ──

  public Optional<JobReport> report(String jobId) {
    return get(jobId).map(job -> new JobReport(job, clock.instant()));
  }

  /**
   * Writes the job's report into {@code directory}.
   *
   * @return the written file, or empty if the job does not exist
   */
  public Optional<Path> exportReport(String jobId, Path directory) throws IOException {
    Optional<JobReport> report = report(jobId);
    if (report.isEmpty()) {
      return Optional.empty();
    }
    Path file = report.get().writeTo(directory);
    logger.info("Exported report for job " + jobId + " to " + file);
    return Optional.of(file);
  }

  /** Current state of a job; live state for active executions, stored state otherwise. */
  public Optional<JobSnapshot> get(String jobId) {
    Optional<Execution> active = registry.get(jobId);
    if (active.isPresent()) {
      return Optional.of(active.get().job().snapshot());
    }
    return load(jobId);
  }

  /** All jobs, oldest first. */
  public List<JobSnapshot> list() {
    List<JobSnapshot> stored = withConnection("list jobs", jobStore::findAll);
    Map<String, JobSnapshot> merged = new LinkedHashMap<>();
    for (JobSnapshot job : stored) {
      merged.put(job.id(), job);
    }
    for (Execution execution : registry.all()) {
      merged.computeIfPresent(execution.job().id(), (id, old) -> execution.job().snapshot());
    }
    return new ArrayList<>(merged.values());
  }

  public List<JobSnapshot> listByStatus(JobStatus status) {
    Objects.requireNonNull(status, "status");
    return list().stream().filter(job -> job.status() == status).toList();
  }

  /** Jobs with a live execution, queued or running. */
  public List<JobSnapshot> active() {
    return registry.all().stream().map(execution -> execution.job().snapshot()).toList();
  }

  public boolean isScheduled(String jobId) {
    return scheduler.isScheduled(jobId);
  }

  // ── Listeners ──

  public JobManager addListener(JobListener listener) {
    listeners.add(listener);
    return this;
  }

  public JobManager addListener(String jobId, JobListener listener) {
    listeners.add(jobId, listener);
    return this;
  }

  public boolean removeListener(JobListener listener) {
    return listeners.remove(listener);
  }

  // ── Recovery & shutdown ──

  /**
   * Restores state left by a previous process: jobs still marked {@code RUNNING} become
   * {@code PAUSED} so they can be resumed from their cursor, and {@code PENDING} jobs with a
   * scheduled start get their timer back (firing at once if the instant has passed).
   *
   * @return number of jobs paused or rescheduled
   */
  public int recover() {
    ensureOpen();
    int recovered = 0;
    for (JobSnapshot stored : withConnection("list jobs", jobStore::findAll)) {
      if (registry.isActive(stored.id())) continue;
      if (stored.status() == JobStatus.RUNNING) {
        Job job = Job.restore(stored);
        job.transitionTo(JobStatus.PAUSED, clock.instant());
        job.logError("job", RESTART_REASON, clock.instant());
        afterOperatorTransition(job, JobStatus.RUNNING);
        logger.info("Recovered interrupted job " + job.id() + " as PAUSED at cursor "
            + job.recipientCursor());
        recovered++;
      } else if (stored.status() == JobStatus.PENDING && stored.scheduledAt() != null) {
        String jobId = stored.id();
        if (scheduler.schedule(jobId, stored.scheduledAt(), () -> startScheduled(jobId))) {
          recovered++;
        }
      }
    }
    return recovered;
  }

  /**
   * Stops timers, pauses running jobs (persisting them as {@code PAUSED}) and stops the
   * workers, waiting up to the drain timeout. Paused jobs can be resumed by a new manager.
   */
  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    scheduler.close();
    for (Execution execution : registry.all()) {
      Job job = execution.job();
      JobStatus previous = job.status();
      if (execution.control().pause()) {
        afterOperatorTransition(job, previous);
      }
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; " + registry.size() + " job executions still active");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    for (Execution execution : registry.all()) {
      registry.remove(execution);
    }
    metrics.recordActiveJobs(0);
    logger.info("Job manager closed");
  }

  // ── Internals ──

  private void startScheduled(String jobId) {
    Optional<JobSnapshot> stored = load(jobId);
    if (stored.isEmpty() || stored.get().status() != JobStatus.PENDING) {
      return;
    }
    logger.info("Scheduled start of job " + jobId);
    if (!start(jobId) && !closed && !registry.isActive(jobId) && slots.availablePermits() == 0) {
      Instant retryAt = clock.instant().plusSeconds(BUSY_RETRY_SECONDS);
      logger.info("Job " + jobId + " postponed to " + retryAt + ": all workers busy");
      scheduler.schedule(jobId, retryAt, () -> startScheduled(jobId));
    }
  }

  private void runExecution(Execution execution) {
    try {
      engine.execute(execution.job(), execution.control());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Execution of job " + execution.job().id() + " failed", e);
    } finally {
      slots.release();
      registry.remove(execution);
      metrics.recordActiveJobs(registry.size());
    }
  }

  private void awaitStopped(Execution execution) {
    try {
      if (!execution.awaitDone(drainTimeout)) {
        logger.warning("Job " + execution.job().id() + " did not stop within " + drainTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void afterOperatorTransition(Job job, JobStatus previous) {
    persist(job);
    listeners.onStatusChanged(job.snapshot(), previous);
  }

  /**
   * Saves a job; failures are logged and do not interrupt the caller. Worker checkpoints and
   * operator transitions race, so snapshot and write happen under the job's monitor and the
   * last writer always stores the newest state.
   */
  private void persist(Job job) {
    synchronized (job) {
      JobSnapshot snapshot = job.snapshot();
      try {
        inTransaction("update job " + job.id(), conn -> jobStore.update(conn, snapshot));
      } catch (JobStoreException e) {
        logger.log(Level.SEVERE, "Failed to persist job " + job.id(), e);
      }
    }
  }

  private Optional<JobSnapshot> load(String jobId) {
    return withConnection("load job " + jobId, conn -> jobStore.findById(conn, jobId));
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("JobManager is closed");
    }
  }

  private <T> T withConnection(String action, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to " + action, e);
    }
  }

  private <T> T inTransaction(String action, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = op.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new JobStoreException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Builder for {@link JobManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private IdentityPool identityPool;
    private RecipientSets recipientSets;
    private TemplateStore templateStore;
    private PacingPolicy pacing;
    private Sleeper sleeper;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxConcurrentJobs = 3;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private final List<JobListener> listeners = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the connection provider used for job persistence.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the job persistence backend.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the job store
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param identityPool source of sender identities and channels
     * @return this builder
     */
    public Builder identityPool(IdentityPool identityPool) {
      this.identityPool = identityPool;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param recipientSets the recipient sets jobs refer to
     * @return this builder
     */
    public Builder recipientSets(RecipientSets recipientSets) {
      this.recipientSets = recipientSets;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param templateStore the template store jobs refer to
     * @return this builder
     */
    public Builder templateStore(TemplateStore templateStore) {
      this.templateStore = templateStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link RandomPacingPolicy#defaults()}.
     *
     * @param pacing the pacing policy shared by all jobs
     * @return this builder
     */
    public Builder pacing(PacingPolicy pacing) {
      this.pacing = pacing;
      return this;
    }

    /**
     * Optional. Defaults to {@link Sleeper#CANCELLABLE}.
     *
     * @param sleeper the sleeper used for every wait
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
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
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock for timestamps, schedules and template placeholders
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how many jobs may run at the same time.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxConcurrentJobs worker thread count
     * @return this builder
     */
    public Builder maxConcurrentJobs(int maxConcurrentJobs) {
      this.maxConcurrentJobs = maxConcurrentJobs;
      return this;
    }

    /**
     * Sets how long {@link JobManager#close()} and {@link JobManager#delete} wait for
     * executions to stop.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout the drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Appends a global job listener.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(JobListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public JobManager build() {
      return new JobManager(this);
    }
  }
}
