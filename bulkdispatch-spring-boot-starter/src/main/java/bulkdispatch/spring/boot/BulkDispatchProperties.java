package bulkdispatch.spring.boot;

import bulkdispatch.dispatch.RandomPacingPolicy;
import bulkdispatch.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the dispatch engine.
 *
 * @see BulkDispatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "bulkdispatch")
public class BulkDispatchProperties {

    /**
     * Prefix of the job tables ({@code <prefix>job}, {@code <prefix>job_identity},
     * {@code <prefix>job_error}).
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    private final Pacing pacing = new Pacing();
    private final Jobs jobs = new Jobs();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Pacing getPacing() {
        return pacing;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Pacing {
        /**
         * Lower bound of the random delay between two messages.
         */
        private Duration minDelay = RandomPacingPolicy.DEFAULT_MIN_DELAY;

        /**
         * Upper bound of the random delay between two messages.
         */
        private Duration maxDelay = RandomPacingPolicy.DEFAULT_MAX_DELAY;

        /**
         * Pause after rotating to another identity because the cap was reached.
         */
        private Duration identitySwitchDelay = RandomPacingPolicy.DEFAULT_SWITCH_DELAY;

        /**
         * Messages sent by one identity before rotating.
         */
        private int messagesPerIdentity = RandomPacingPolicy.DEFAULT_MESSAGES_PER_IDENTITY;

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getIdentitySwitchDelay() {
            return identitySwitchDelay;
        }

        public void setIdentitySwitchDelay(Duration identitySwitchDelay) {
            this.identitySwitchDelay = identitySwitchDelay;
        }

        public int getMessagesPerIdentity() {
            return messagesPerIdentity;
        }

        public void setMessagesPerIdentity(int messagesPerIdentity) {
            this.messagesPerIdentity = messagesPerIdentity;
        }
    }

    public static class Jobs {
        /**
         * Jobs executed at the same time. Starting another job is rejected while all are
         * busy; paused jobs do not count.
         */
        private int maxConcurrent = 3;

        /**
         * Pause jobs left RUNNING by a previous process and restore scheduled starts.
         */
        private boolean recoverOnStartup = true;

        /**
         * How long shutdown waits for running jobs to checkpoint.
         */
        private Duration drainTimeout = Duration.ofSeconds(5);

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public boolean isRecoverOnStartup() {
            return recoverOnStartup;
        }

        public void setRecoverOnStartup(boolean recoverOnStartup) {
            this.recoverOnStartup = recoverOnStartup;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "bulkdispatch";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
