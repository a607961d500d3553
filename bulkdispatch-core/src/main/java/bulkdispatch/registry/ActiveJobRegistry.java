package bulkdispatch.registry;

import bulkdispatch.dispatch.JobControl;
import bulkdispatch.model.Job;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Registry of job executions that have been started and not yet finished, whether queued
 * for a worker or running.
 *
 * <p>Registration is atomic per job id: a second registration for the same id fails until
 * the first execution is removed.
 *
 * <p>This class is thread-safe.
 */
public final class ActiveJobRegistry {
  private final ConcurrentMap<String, Execution> executions = new ConcurrentHashMap<>();

  /**
   * @return the registered execution, or empty if one already exists for the job id
   */
  public Optional<Execution> register(Job job, JobControl control) {
    Execution execution = new Execution(job, control);
    Execution existing = executions.putIfAbsent(job.id(), execution);
    return existing == null ? Optional.of(execution) : Optional.empty();
  }

  public Optional<Execution> get(String jobId) {
    return Optional.ofNullable(executions.get(jobId));
  }

  /** Removes the entry only if it is still {@code execution}, and marks it done. */
  public void remove(Execution execution) {
    executions.remove(execution.job().id(), execution);
    execution.done.countDown();
  }

  public boolean isActive(String jobId) {
    return executions.containsKey(jobId);
  }

  public Collection<Execution> all() {
    return List.copyOf(executions.values());
  }

  public int size() {
    return executions.size();
  }

  /** One registered execution: the live job, its control and a completion latch. */
  public static final class Execution {
    private final Job job;
    private final JobControl control;
    private final CountDownLatch done = new CountDownLatch(1);

    private Execution(Job job, JobControl control) {
      this.job = Objects.requireNonNull(job, "job");
      this.control = Objects.requireNonNull(control, "control");
    }

    public Job job() {
      return job;
    }

    public JobControl control() {
      return control;
    }

    /**
     * @return {@code true} if the execution finished within {@code timeout}
     */
    public boolean awaitDone(Duration timeout) throws InterruptedException {
      return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}
