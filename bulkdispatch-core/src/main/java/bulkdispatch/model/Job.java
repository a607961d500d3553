package bulkdispatch.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one bulk dispatch job.
 *
 * <p>All accessors and mutators are synchronized: the running execution advances counters and
 * the cursor while operator threads pause, resume or cancel it. Counters only move through
 * {@link #recordDelivered()}, {@link #recordFailed(String, String, Instant)} and
 * {@link #recordSkipped()}, which keeps {@code sent == success + failed}.
 *
 * @see JobSnapshot
 */
public final class Job {
  private final String id;
  private final String name;
  private final String templateId;
  private final String recipientSetId;
  private final List<String> identityHandles;
  private final Instant createdAt;
  private final Instant scheduledAt;

  private JobStatus status;
  private int total;
  private int sent;
  private int success;
  private int failed;
  private int skipped;
  private int recipientCursor;
  private int identityCursor;
  private int recipientLimit;
  private Instant startedAt;
  private Instant completedAt;
  private final List<ErrorEntry> errors;

  private Job(JobSnapshot s) {
    this.id = s.id();
    this.name = s.name();
    this.templateId = s.templateId();
    this.recipientSetId = s.recipientSetId();
    this.identityHandles = s.identityHandles();
    this.createdAt = s.createdAt();
    this.scheduledAt = s.scheduledAt();
    this.status = s.status();
    this.total = s.total();
    this.sent = s.sent();
    this.success = s.success();
    this.failed = s.failed();
    this.skipped = s.skipped();
    this.recipientCursor = s.recipientCursor();
    this.identityCursor = s.identityCursor();
    this.recipientLimit = s.recipientLimit();
    this.startedAt = s.startedAt();
    this.completedAt = s.completedAt();
    this.errors = new ArrayList<>(s.errors());
  }

  /**
   * Creates a new {@link JobStatus#PENDING} job with zeroed counters and cursors.
   */
  public static Job create(String id, String name, String templateId, String recipientSetId,
      List<String> identityHandles, Instant createdAt, Instant scheduledAt) {
    Objects.requireNonNull(identityHandles, "identityHandles");
    if (identityHandles.isEmpty()) {
      throw new IllegalArgumentException("identityHandles must not be empty");
    }
    return new Job(new JobSnapshot(id, name, JobStatus.PENDING, templateId, recipientSetId,
        identityHandles, 0, 0, 0, 0, 0, -1, 0, -1, createdAt, null, null, scheduledAt,
        List.of()));
  }

  /** Rebuilds a live job from persisted state. */
  public static Job restore(JobSnapshot snapshot) {
    return new Job(Objects.requireNonNull(snapshot, "snapshot"));
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String templateId() {
    return templateId;
  }

  public String recipientSetId() {
    return recipientSetId;
  }

  public List<String> identityHandles() {
    return identityHandles;
  }

  public Instant scheduledAt() {
    return scheduledAt;
  }

  public synchronized JobStatus status() {
    return status;
  }

  public synchronized int recipientCursor() {
    return recipientCursor;
  }

  public synchronized int identityCursor() {
    return identityCursor;
  }

  public synchronized int recipientLimit() {
    return recipientLimit;
  }

  public synchronized Instant startedAt() {
    return startedAt;
  }

  /**
   * Moves the job to {@code next} if the status machine allows it. Entering {@code RUNNING}
   * for the first time stamps {@code startedAt}; entering a terminal status stamps
   * {@code completedAt}.
   *
   * @return {@code true} if the transition happened
   */
  public synchronized boolean transitionTo(JobStatus next, Instant now) {
    if (!status.canTransitionTo(next)) {
      return false;
    }
    status = next;
    if (next == JobStatus.RUNNING && startedAt == null) {
      startedAt = now;
    }
    if (next.isTerminal()) {
      completedAt = now;
    }
    return true;
  }

  /** Sets the total once, before the first run starts, leaving the recipient limit unset. */
  public synchronized void initTotal(int total) {
    initTotal(total, -1);
  }

  /**
   * Fixes the job's scope before the first run starts: {@code total} valid recipients, all
   * positioned below {@code recipientLimit}.
   */
  public synchronized void initTotal(int total, int recipientLimit) {
    if (startedAt != null) {
      throw new IllegalStateException("Total is fixed once job " + id + " has started");
    }
    if (total < 0) {
      throw new IllegalArgumentException("total must be >= 0");
    }
    this.total = total;
    this.recipientLimit = recipientLimit;
  }

  public synchronized void recordDelivered() {
    sent++;
    success++;
  }

  public synchronized void recordFailed(String recipient, String reason, Instant at) {
    sent++;
    failed++;
    errors.add(new ErrorEntry(recipient, reason, at));
  }

  public synchronized void recordSkipped() {
    skipped++;
  }

  /** Appends a job-level entry to the error log without touching counters. */
  public synchronized void logError(String subject, String reason, Instant at) {
    errors.add(new ErrorEntry(subject, reason, at));
  }

  /**
   * Marks the recipient at {@code position} as finally processed.
   *
   * @throws IllegalArgumentException if {@code position} is not ahead of the current cursor
   */
  public synchronized void advanceCursor(int position) {
    if (position <= recipientCursor) {
      throw new IllegalArgumentException("Cursor must move forward: " + recipientCursor
          + " -> " + position);
    }
    recipientCursor = position;
  }

  public synchronized void identityCursor(int identityCursor) {
    this.identityCursor = identityCursor;
  }

  public synchronized JobSnapshot snapshot() {
    return new JobSnapshot(id, name, status, templateId, recipientSetId, identityHandles,
        total, sent, success, failed, skipped, recipientCursor, identityCursor, recipientLimit,
        createdAt, startedAt, completedAt, scheduledAt, errors);
  }

  @Override
  public synchronized String toString() {
    return "Job[" + id + ", " + name + ", " + status + "]";
  }
}
