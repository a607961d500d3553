package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.TableNames;

import java.util.List;

/**
 * MySQL job store. Also handles MariaDB and TiDB URLs, which accept the same DDL.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public MySqlJobStore withTables(TableNames tables) {
    return new MySqlJobStore(tables);
  }
}
