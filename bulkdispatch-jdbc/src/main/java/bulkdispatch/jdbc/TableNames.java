package bulkdispatch.jdbc;

import java.util.Objects;

/**
 * Table naming for the JDBC job store. All tables share one prefix:
 * {@code <prefix>job}, {@code <prefix>job_identity} and {@code <prefix>job_error}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "dispatch_";
  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String jobs;
  private final String identities;
  private final String errors;

  private TableNames(String prefix) {
    this.jobs = prefix + "job";
    this.identities = prefix + "job_identity";
    this.errors = prefix + "job_error";
  }

  public static TableNames withPrefix(String prefix) {
    return new TableNames(validatePrefix(prefix));
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_PREFIX);
  }

  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public String jobs() {
    return jobs;
  }

  public String identities() {
    return identities;
  }

  public String errors() {
    return errors;
  }
}
