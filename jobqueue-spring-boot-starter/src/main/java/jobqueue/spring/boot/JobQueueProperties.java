package jobqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the job queue.
 *
 * @see JobQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobqueue")
public class JobQueueProperties {

    /**
     * Database table name for jobs.
     */
    private String tableName = "job_queue";

    private final Worker worker = new Worker();
    private final Resilience resilience = new Resilience();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Worker getWorker() {
        return worker;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        /**
         * Whether this application consumes jobs. Producer-only applications set this to false.
         */
        private boolean enabled = true;
        private long intervalMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Resilience {
        private int maxRetries = 3;
        private Duration callTimeout = Duration.ofSeconds(30);
        private final Retry retry = new Retry();
        private final Breaker breaker = new Breaker();

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Retry getRetry() {
            return retry;
        }

        public Breaker getBreaker() {
            return breaker;
        }
    }

    public static class Retry {
        private long initialDelayMs = 1000;
        private double multiplier = 2.0;
        private long maxDelayMs = 10000;

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration resetTimeout = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getResetTimeout() {
            return resetTimeout;
        }

        public void setResetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobqueue";

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
