package bulkdispatch.spring.boot;

import bulkdispatch.JobListener;
import bulkdispatch.JobManager;
import bulkdispatch.dispatch.RandomPacingPolicy;
import bulkdispatch.jdbc.DataSourceConnectionProvider;
import bulkdispatch.jdbc.TableNames;
import bulkdispatch.jdbc.store.AbstractJdbcJobStore;
import bulkdispatch.jdbc.store.JdbcJobStores;
import bulkdispatch.memory.Blacklist;
import bulkdispatch.memory.ChannelFactory;
import bulkdispatch.memory.InMemoryIdentityPool;
import bulkdispatch.memory.InMemoryRecipientSets;
import bulkdispatch.memory.InMemoryRoutePool;
import bulkdispatch.memory.InMemoryTemplateStore;
import bulkdispatch.spi.ConnectionProvider;
import bulkdispatch.spi.IdentityPool;
import bulkdispatch.spi.MetricsExporter;
import bulkdispatch.spi.RecipientSets;
import bulkdispatch.spi.RoutePool;
import bulkdispatch.spi.TemplateStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Auto-configuration for the dispatch engine.
 *
 * <p>Wires a {@link JobManager} from a {@link DataSource}, {@link BulkDispatchProperties} and
 * the application's collaborators. In-memory recipient sets, templates and routes are supplied
 * when the application defines none. The identity pool is built from a {@link ChannelFactory}
 * bean, since only the application knows how to talk to its messaging provider; without either
 * an {@link IdentityPool} or a {@link ChannelFactory} no manager is created.
 *
 * @see BulkDispatchProperties
 * @see BulkDispatchMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobManager.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(BulkDispatchProperties.class)
public class BulkDispatchAutoConfiguration {
    private static final Logger logger = Logger.getLogger(BulkDispatchAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcJobStore jobStore(DataSource dataSource, BulkDispatchProperties props) {
        return JdbcJobStores.detect(dataSource, TableNames.withPrefix(props.getTablePrefix()));
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public Blacklist blacklist() {
        return new Blacklist();
    }

    @Bean
    @ConditionalOnMissingBean(RecipientSets.class)
    public InMemoryRecipientSets recipientSets(Blacklist blacklist) {
        return new InMemoryRecipientSets(blacklist);
    }

    @Bean
    @ConditionalOnMissingBean(TemplateStore.class)
    public InMemoryTemplateStore templateStore() {
        return new InMemoryTemplateStore();
    }

    @Bean
    @ConditionalOnMissingBean(RoutePool.class)
    public InMemoryRoutePool routePool() {
        return new InMemoryRoutePool();
    }

    @Bean
    @ConditionalOnMissingBean(IdentityPool.class)
    @ConditionalOnBean(ChannelFactory.class)
    public InMemoryIdentityPool identityPool(ChannelFactory channelFactory, RoutePool routePool) {
        return new InMemoryIdentityPool(channelFactory, routePool);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(IdentityPool.class)
    public JobManager jobManager(BulkDispatchProperties props,
                                 ConnectionProvider connectionProvider,
                                 AbstractJdbcJobStore jobStore,
                                 IdentityPool identityPool,
                                 RecipientSets recipientSets,
                                 TemplateStore templateStore,
                                 ObjectProvider<MetricsExporter> metricsProvider,
                                 ObjectProvider<JobListener> listenerProvider) {
        BulkDispatchProperties.Pacing pacing = props.getPacing();
        BulkDispatchProperties.Jobs jobs = props.getJobs();

        var builder = JobManager.builder()
                .connectionProvider(connectionProvider)
                .jobStore(jobStore)
                .identityPool(identityPool)
                .recipientSets(recipientSets)
                .templateStore(templateStore)
                .pacing(new RandomPacingPolicy(pacing.getMinDelay(), pacing.getMaxDelay(),
                        pacing.getIdentitySwitchDelay(), pacing.getMessagesPerIdentity()))
                .maxConcurrentJobs(jobs.getMaxConcurrent())
                .drainTimeout(jobs.getDrainTimeout());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        listenerProvider.orderedStream().forEach(builder::listener);
        JobManager manager = builder.build();

        if (jobs.isRecoverOnStartup()) {
            int recovered = manager.recover();
            if (recovered > 0) {
                logger.info("Recovered " + recovered + " job(s) from " + jobStore.name() + " job store");
            }
        }
        return manager;
    }
}
