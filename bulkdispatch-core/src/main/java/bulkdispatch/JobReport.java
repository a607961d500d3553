package bulkdispatch;

import bulkdispatch.model.ErrorEntry;
import bulkdispatch.model.JobSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text summary of a job, detached from the live job.
 *
 * <pre>
 * Job Report: newsletter
 * Job ID: 7c0e...
 * Status: COMPLETED
 * Created: 2024-05-01T10:00:00Z
 * Started: 2024-05-01T10:00:01Z
 * Completed: 2024-05-01T10:42:13Z
 *
 * === Statistics ===
 * Total Recipients: 120
 * Sent: 118
 * ...
 * </pre>
 */
public record JobReport(JobSnapshot job, Instant generatedAt) {
  private static final DateTimeFormatter FILE_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  public JobReport {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(generatedAt, "generatedAt");
  }

  public String render() {
    List<String> lines = new ArrayList<>();
    lines.add("Job Report: " + job.name());
    lines.add("Job ID: " + job.id());
    lines.add("Status: " + job.status());
    lines.add("Created: " + job.createdAt());
    lines.add("Started: " + orNa(job.startedAt()));
    lines.add("Completed: " + orNa(job.completedAt()));
    lines.add("");
    lines.add("=== Statistics ===");
    lines.add("Total Recipients: " + job.total());
    lines.add("Sent: " + job.sent());
    lines.add("Success: " + job.success());
    lines.add("Failed: " + job.failed());
    lines.add("Skipped: " + job.skipped());
    lines.add("");
    if (!job.errors().isEmpty()) {
      lines.add("=== Errors ===");
      for (ErrorEntry error : job.errors()) {
        lines.add("- " + error.recipient() + ": " + error.reason());
      }
    }
    return String.join("\n", lines);
  }

  /** {@code report_<jobId>_<yyyyMMdd_HHmmss>.txt}, stamped in UTC. */
  public String defaultFileName() {
    return "report_" + job.id() + "_" + FILE_STAMP.format(generatedAt) + ".txt";
  }

  /**
   * Writes the report into {@code directory} (created if missing) under
   * {@link #defaultFileName()}.
   *
   * @return the written file
   */
  public Path writeTo(Path directory) throws IOException {
    Files.createDirectories(directory);
    Path file = directory.resolve(defaultFileName());
    Files.writeString(file, render(), StandardCharsets.UTF_8);
    return file;
  }

  private static String orNa(Instant instant) {
    return instant == null ? "N/A" : instant.toString();
  }
}
