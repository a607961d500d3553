package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.TableNames;

import java.util.List;

/**
 * PostgreSQL job store.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresJobStore withTables(TableNames tables) {
    return new PostgresJobStore(tables);
  }
}
