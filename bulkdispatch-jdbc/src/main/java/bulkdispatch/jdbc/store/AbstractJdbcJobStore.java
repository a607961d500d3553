package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.JdbcTemplate;
import bulkdispatch.jdbc.TableNames;
import bulkdispatch.model.ErrorEntry;
import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;
import bulkdispatch.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>A job is stored as one row in {@code <prefix>job}, its identity handles in
 * {@code <prefix>job_identity} (ordered by {@code handle_order}) and its error log in
 * {@code <prefix>job_error} (ordered by {@code seq}). Updates append error entries beyond the
 * highest stored sequence number and never rewrite existing ones.
 *
 * <p>Subclasses identify the database they serve. Register custom implementations via
 * {@code META-INF/services/bulkdispatch.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_REASON_LENGTH = 4000;
  private static final int MAX_RECIPIENT_LENGTH = 255;

  private static final String JOB_COLUMNS = "job_id, name, status, template_id, recipient_set_id, "
      + "total, sent, success, failed, skipped, recipient_cursor, identity_cursor, recipient_limit, "
      + "created_at, started_at, completed_at, scheduled_at";

  private static final JdbcTemplate.RowMapper<JobRow> JOB_ROW_MAPPER = rs -> new JobRow(
      rs.getString("job_id"),
      rs.getString("name"),
      JobStatus.fromCode(rs.getInt("status")),
      rs.getString("template_id"),
      rs.getString("recipient_set_id"),
      rs.getInt("total"),
      rs.getInt("sent"),
      rs.getInt("success"),
      rs.getInt("failed"),
      rs.getInt("skipped"),
      rs.getInt("recipient_cursor"),
      rs.getInt("identity_cursor"),
      rs.getInt("recipient_limit"),
      JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("started_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("completed_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("scheduled_at")));

  private static final JdbcTemplate.RowMapper<ErrorEntry> ERROR_ROW_MAPPER = rs -> new ErrorEntry(
      rs.getString("recipient"),
      rs.getString("reason"),
      JdbcTemplate.toInstant(rs.getTimestamp("occurred_at")));

  private final TableNames tables;

  protected AbstractJdbcJobStore() {
    this(TableNames.defaults());
  }

  protected AbstractJdbcJobStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind using the given tables.
   */
  public abstract AbstractJdbcJobStore withTables(TableNames tables);

  /** Classpath location of the DDL for this database. */
  public String schemaResource() {
    return "bulkdispatch/schema/" + name() + ".sql";
  }

  protected TableNames tables() {
    return tables;
  }

  @Override
  public void insert(Connection conn, JobSnapshot job) {
    String sql = "INSERT INTO " + tables.jobs() + " (" + JOB_COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        job.id(), job.name(), job.status().code(), job.templateId(), job.recipientSetId(),
        job.total(), job.sent(), job.success(), job.failed(), job.skipped(),
        job.recipientCursor(), job.identityCursor(), job.recipientLimit(),
        job.createdAt(), job.startedAt(), job.completedAt(), job.scheduledAt());

    List<Object[]> handles = new ArrayList<>();
    for (int i = 0; i < job.identityHandles().size(); i++) {
      handles.add(new Object[] {job.id(), i, job.identityHandles().get(i)});
    }
    JdbcTemplate.batchUpdate(conn, "INSERT INTO " + tables.identities()
        + " (job_id, handle_order, handle) VALUES (?,?,?)", handles);
    appendErrors(conn, job.id(), job.errors(), 0);
  }

  @Override
  public int update(Connection conn, JobSnapshot job) {
    String sql = "UPDATE " + tables.jobs() + " SET status=?, total=?, sent=?, success=?, failed=?, "
        + "skipped=?, recipient_cursor=?, identity_cursor=?, recipient_limit=?, started_at=?, "
        + "completed_at=? "
        + "WHERE job_id=?";
    int updated = JdbcTemplate.update(conn, sql,
        job.status().code(), job.total(), job.sent(), job.success(), job.failed(), job.skipped(),
        job.recipientCursor(), job.identityCursor(), job.recipientLimit(), job.startedAt(),
        job.completedAt(), job.id());
    if (updated == 0) {
      return 0;
    }
    int stored = storedErrorCount(conn, job.id());
    appendErrors(conn, job.id(), job.errors(), stored);
    return updated;
  }

  @Override
  public Optional<JobSnapshot> findById(Connection conn, String jobId) {
    return JdbcTemplate.queryOne(conn,
            "SELECT " + JOB_COLUMNS + " FROM " + tables.jobs() + " WHERE job_id=?",
            JOB_ROW_MAPPER, jobId)
        .map(row -> assemble(conn, row));
  }

  @Override
  public List<JobSnapshot> findAll(Connection conn) {
    List<JobRow> rows = JdbcTemplate.query(conn,
        "SELECT " + JOB_COLUMNS + " FROM " + tables.jobs() + " ORDER BY created_at, job_id",
        JOB_ROW_MAPPER);
    return rows.stream().map(row -> assemble(conn, row)).toList();
  }

  @Override
  public List<JobSnapshot> findByStatus(Connection conn, JobStatus status) {
    List<JobRow> rows = JdbcTemplate.query(conn,
        "SELECT " + JOB_COLUMNS + " FROM " + tables.jobs()
            + " WHERE status=? ORDER BY created_at, job_id",
        JOB_ROW_MAPPER, status.code());
    return rows.stream().map(row -> assemble(conn, row)).toList();
  }

  @Override
  public boolean delete(Connection conn, String jobId) {
    JdbcTemplate.update(conn, "DELETE FROM " + tables.errors() + " WHERE job_id=?", jobId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.identities() + " WHERE job_id=?", jobId);
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.jobs() + " WHERE job_id=?", jobId) > 0;
  }

  protected int storedErrorCount(Connection conn, String jobId) {
    return JdbcTemplate.queryOne(conn,
            "SELECT COUNT(*) FROM " + tables.errors() + " WHERE job_id=?",
            rs -> rs.getInt(1), jobId)
        .orElse(0);
  }

  private void appendErrors(Connection conn, String jobId, List<ErrorEntry> errors, int from) {
    List<Object[]> rows = new ArrayList<>();
    for (int seq = from; seq < errors.size(); seq++) {
      ErrorEntry error = errors.get(seq);
      rows.add(new Object[] {jobId, seq, truncate(error.recipient(), MAX_RECIPIENT_LENGTH),
          truncate(error.reason(), MAX_REASON_LENGTH), error.occurredAt()});
    }
    JdbcTemplate.batchUpdate(conn, "INSERT INTO " + tables.errors()
        + " (job_id, seq, recipient, reason, occurred_at) VALUES (?,?,?,?,?)", rows);
  }

  private JobSnapshot assemble(Connection conn, JobRow row) {
    List<String> handles = JdbcTemplate.query(conn,
        "SELECT handle FROM " + tables.identities() + " WHERE job_id=? ORDER BY handle_order",
        rs -> rs.getString("handle"), row.id());
    List<ErrorEntry> errors = JdbcTemplate.query(conn,
        "SELECT recipient, reason, occurred_at FROM " + tables.errors()
            + " WHERE job_id=? ORDER BY seq",
        ERROR_ROW_MAPPER, row.id());
    return new JobSnapshot(row.id(), row.name(), row.status(), row.templateId(),
        row.recipientSetId(), handles, row.total(), row.sent(), row.success(), row.failed(),
        row.skipped(), row.recipientCursor(), row.identityCursor(), row.recipientLimit(),
        row.createdAt(),
        row.startedAt(), row.completedAt(), row.scheduledAt(), errors);
  }

  private static String truncate(String value, int max) {
    if (value == null) return null;
    return value.length() <= max ? value : value.substring(0, max);
  }

  private record JobRow(
      String id,
      String name,
      JobStatus status,
      String templateId,
      String recipientSetId,
      int total,
      int sent,
      int success,
      int failed,
      int skipped,
      int recipientCursor,
      int identityCursor,
      int recipientLimit,
      Instant createdAt,
      Instant startedAt,
      Instant completedAt,
      Instant scheduledAt
  ) {
  }
}
