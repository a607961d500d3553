/**
 * JDBC support: connection provider, a small statement helper and table naming.
 *
 * <p>Store implementations live in {@link bulkdispatch.jdbc.store}.
 *
 * @see bulkdispatch.jdbc.store.JdbcJobStores
 */
package bulkdispatch.jdbc;
