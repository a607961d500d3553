/**
 * Database-specific {@link bulkdispatch.spi.JobStore} implementations and the
 * {@link bulkdispatch.jdbc.store.JdbcJobStores} registry that detects them from a JDBC URL.
 */
package bulkdispatch.jdbc.store;
