package bulkdispatch.spi;

import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for jobs. Every method takes an explicit connection; callers own its
 * lifecycle and transaction boundaries.
 *
 * <p>{@link #update} must persist counters, cursors, status and timestamps, and append error
 * log entries that are not yet stored. Error entries are never rewritten.
 *
 * @see bulkdispatch.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  void insert(Connection conn, JobSnapshot job);

  /**
   * @return number of job rows updated ({@code 0} if the job no longer exists)
   */
  int update(Connection conn, JobSnapshot job);

  Optional<JobSnapshot> findById(Connection conn, String jobId);

  /** All jobs, oldest first. */
  List<JobSnapshot> findAll(Connection conn);

  List<JobSnapshot> findByStatus(Connection conn, JobStatus status);

  /**
   * @return {@code true} if a job was removed
   */
  boolean delete(Connection conn, String jobId);
}
