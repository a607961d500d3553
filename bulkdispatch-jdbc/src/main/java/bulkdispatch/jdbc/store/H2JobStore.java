package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.TableNames;

import java.util.List;

/**
 * H2 job store. Primarily for testing and embedded deployments.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2JobStore withTables(TableNames tables) {
    return new H2JobStore(tables);
  }
}
