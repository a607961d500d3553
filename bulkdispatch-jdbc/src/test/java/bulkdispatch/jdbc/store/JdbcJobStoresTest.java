package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.H2Schema;
import bulkdispatch.jdbc.TableNames;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoresTest {

  @Test
  void allStoresRegistered() {
    assertEquals(3, JdbcJobStores.all().size());
  }

  @Test
  void getByNameIgnoresCase() {
    assertInstanceOf(H2JobStore.class, JdbcJobStores.get("H2"));
    assertInstanceOf(MySqlJobStore.class, JdbcJobStores.get("mysql"));
    assertInstanceOf(PostgresJobStore.class, JdbcJobStores.get("postgresql"));
  }

  @Test
  void getUnknownThrows() {
    var e = assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:mysql://localhost/app"));
    assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:mariadb://localhost/app"));
    assertInstanceOf(PostgresJobStore.class, JdbcJobStores.detect("JDBC:POSTGRESQL://db/app"));
    assertInstanceOf(H2JobStore.class, JdbcJobStores.detect("jdbc:h2:mem:test"));
  }

  @Test
  void detectRejectsUnsupportedUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect("jdbc:sqlite:app.db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect((String) null));
  }

  @Test
  void detectFromDataSourceWithTables() {
    var dataSource = H2Schema.newDataSource("detect");

    AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource, TableNames.withPrefix("app_"));

    assertInstanceOf(H2JobStore.class, store);
    assertEquals("bulkdispatch/schema/h2.sql", store.schemaResource());
  }
}
