/**
 * Spring Boot auto-configuration for the dispatch engine.
 *
 * <p>Add the starter and a {@link bulkdispatch.memory.ChannelFactory} (or a full
 * {@link bulkdispatch.spi.IdentityPool}) bean; the {@link bulkdispatch.JobManager} is wired from
 * the application's {@link javax.sql.DataSource} and {@code bulkdispatch.*} properties.
 */
package bulkdispatch.spring.boot;
