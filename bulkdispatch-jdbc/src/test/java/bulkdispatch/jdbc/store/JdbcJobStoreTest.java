package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.H2Schema;
import bulkdispatch.jdbc.TableNames;
import bulkdispatch.model.ErrorEntry;
import bulkdispatch.model.Job;
import bulkdispatch.model.JobSnapshot;
import bulkdispatch.model.JobStatus;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {
  private static final Instant T0 = Instant.parse("2024-04-01T12:00:00Z");

  private JdbcDataSource dataSource;
  private H2JobStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Schema.newDataSource("store");
    H2Schema.create(dataSource);
    store = new H2JobStore();
  }

  @AfterEach
  void tearDown() throws SQLException {
    H2Schema.drop(dataSource, TableNames.DEFAULT_PREFIX);
  }

  private static Job job(String id, Instant createdAt) {
    return Job.create(id, "Job " + id, "tpl", "set-1", List.of("carol", "alice", "bob"), createdAt,
        createdAt.plus(1, ChronoUnit.HOURS));
  }

  @Test
  void insertAndFindRoundTrip() throws SQLException {
    Job job = job("j1", T0);
    job.logError("job", "warming up", T0);

    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job.snapshot());
      JobSnapshot found = store.findById(conn, "j1").orElseThrow();

      assertEquals(job.snapshot(), found);
      assertEquals(List.of("carol", "alice", "bob"), found.identityHandles());
      assertEquals(-1, found.recipientCursor());
      assertEquals(-1, found.recipientLimit());
      assertEquals(T0.plus(1, ChronoUnit.HOURS), found.scheduledAt());
    }
  }

  @Test
  void updatePersistsProgressAndAppendsOnlyNewErrors() throws SQLException {
    Job job = job("j1", T0);
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job.snapshot());

      job.initTotal(3, 4);
      job.transitionTo(JobStatus.RUNNING, T0.plusSeconds(5));
      job.recordFailed("bob", "blocked", T0.plusSeconds(6));
      job.advanceCursor(0);
      assertEquals(1, store.update(conn, job.snapshot()));

      job.recordDelivered();
      job.advanceCursor(1);
      job.identityCursor(2);
      assertEquals(1, store.update(conn, job.snapshot()));
      assertEquals(1, countRows(conn, "dispatch_job_error"));

      job.recordFailed("eve", "privacy restricted", T0.plusSeconds(9));
      job.advanceCursor(2);
      job.transitionTo(JobStatus.COMPLETED, T0.plusSeconds(10));
      store.update(conn, job.snapshot());

      JobSnapshot found = store.findById(conn, "j1").orElseThrow();
      assertEquals(JobStatus.COMPLETED, found.status());
      assertEquals(3, found.total());
      assertEquals(4, found.recipientLimit());
      assertEquals(3, found.sent());
      assertEquals(1, found.success());
      assertEquals(2, found.failed());
      assertEquals(2, found.recipientCursor());
      assertEquals(2, found.identityCursor());
      assertEquals(T0.plusSeconds(5), found.startedAt());
      assertEquals(T0.plusSeconds(10), found.completedAt());
      assertEquals(List.of(new ErrorEntry("bob", "blocked", T0.plusSeconds(6)),
          new ErrorEntry("eve", "privacy restricted", T0.plusSeconds(9))), found.errors());
    }
  }

  @Test
  void updateOfDeletedJobWritesNothing() throws SQLException {
    Job job = job("gone", T0);
    job.logError("job", "x", T0);
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.update(conn, job.snapshot()));
      assertEquals(0, countRows(conn, "dispatch_job_error"));
    }
  }

  @Test
  void findAllOrdersByCreation() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job("late", T0.plusSeconds(60)).snapshot());
      store.insert(conn, job("early", T0).snapshot());

      assertEquals(List.of("early", "late"), store.findAll(conn).stream().map(JobSnapshot::id).toList());
    }
  }

  @Test
  void findByStatus() throws SQLException {
    Job running = job("r", T0);
    running.transitionTo(JobStatus.RUNNING, T0);
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, running.snapshot());
      store.insert(conn, job("p", T0).snapshot());

      assertEquals(List.of("r"), store.findByStatus(conn, JobStatus.RUNNING).stream()
          .map(JobSnapshot::id).toList());
      assertTrue(store.findByStatus(conn, JobStatus.FAILED).isEmpty());
    }
  }

  @Test
  void deleteRemovesAllRows() throws SQLException {
    Job job = job("j1", T0);
    job.logError("job", "x", T0);
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job.snapshot());

      assertTrue(store.delete(conn, "j1"));
      assertFalse(store.delete(conn, "j1"));
      assertTrue(store.findById(conn, "j1").isEmpty());
      assertEquals(0, countRows(conn, "dispatch_job_identity"));
      assertEquals(0, countRows(conn, "dispatch_job_error"));
    }
  }

  @Test
  void longReasonsAreTruncated() throws SQLException {
    Job job = job("j1", T0);
    job.logError("job", "x".repeat(5000), T0);
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job.snapshot());

      assertEquals(4000, store.findById(conn, "j1").orElseThrow().errors().get(0).reason().length());
    }
  }

  @Test
  void customTablePrefix() throws SQLException {
    H2Schema.create(dataSource, "promo_");
    AbstractJdbcJobStore custom = store.withTables(TableNames.withPrefix("promo_"));
    try (Connection conn = dataSource.getConnection()) {
      custom.insert(conn, job("j1", T0).snapshot());

      assertTrue(custom.findById(conn, "j1").isPresent());
      assertTrue(store.findById(conn, "j1").isEmpty());
    } finally {
      H2Schema.drop(dataSource, "promo_");
    }
  }

  private static int countRows(Connection conn, String table) throws SQLException {
    try (ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
