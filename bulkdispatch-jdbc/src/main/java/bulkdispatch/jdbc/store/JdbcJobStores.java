package bulkdispatch.jdbc.store;

import bulkdispatch.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC job stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/bulkdispatch.jdbc.store.AbstractJdbcJobStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 * AbstractJdbcJobStore custom = JdbcJobStores.detect(dataSource, TableNames.withPrefix("app_"));
 * AbstractJdbcJobStore pg = JdbcJobStores.get("postgresql");
 * }</pre>
 */
public final class JdbcJobStores {

    private static final List<AbstractJdbcJobStore> STORES;
    private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcJobStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcJobStores() {
    }

    /**
     * Returns all registered job stores.
     */
    public static List<AbstractJdbcJobStore> all() {
        return STORES;
    }

    /**
     * Gets a job store by name.
     *
     * @param name store name (case-insensitive)
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcJobStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown job store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the job store from a DataSource.
     *
     * @throws IllegalStateException if the connection URL cannot be read or is not supported
     */
    public static AbstractJdbcJobStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect job store from DataSource", e);
        }
    }

    /**
     * Auto-detects the job store from a DataSource and binds it to the given tables.
     */
    public static AbstractJdbcJobStore detect(DataSource dataSource, TableNames tables) {
        Objects.requireNonNull(tables, "tables");
        return detect(dataSource).withTables(tables);
    }

    /**
     * Auto-detects the job store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no registered store handles the URL
     */
    public static AbstractJdbcJobStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String lower = jdbcUrl.toLowerCase();
        for (AbstractJdbcJobStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
