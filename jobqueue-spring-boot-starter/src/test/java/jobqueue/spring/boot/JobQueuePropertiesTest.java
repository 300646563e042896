package jobqueue.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobQueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(JobQueueProperties.class);
            assertEquals("job_queue", props.getTableName());
            assertTrue(props.getWorker().isEnabled());
            assertEquals(5000, props.getWorker().getIntervalMs());
            assertEquals(3, props.getResilience().getMaxRetries());
            assertEquals(Duration.ofSeconds(30), props.getResilience().getCallTimeout());
            assertEquals(1000, props.getResilience().getRetry().getInitialDelayMs());
            assertEquals(2.0, props.getResilience().getRetry().getMultiplier());
            assertEquals(10000, props.getResilience().getRetry().getMaxDelayMs());
            assertEquals(5, props.getResilience().getBreaker().getFailureThreshold());
            assertEquals(2, props.getResilience().getBreaker().getSuccessThreshold());
            assertEquals(Duration.ofSeconds(60), props.getResilience().getBreaker().getResetTimeout());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("jobqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "jobqueue.table-name=cms_jobs",
                "jobqueue.worker.enabled=false",
                "jobqueue.worker.interval-ms=250",
                "jobqueue.resilience.max-retries=5",
                "jobqueue.resilience.call-timeout=10s",
                "jobqueue.resilience.retry.initial-delay-ms=500",
                "jobqueue.resilience.retry.multiplier=3",
                "jobqueue.resilience.retry.max-delay-ms=20000",
                "jobqueue.resilience.breaker.failure-threshold=10",
                "jobqueue.resilience.breaker.success-threshold=1",
                "jobqueue.resilience.breaker.reset-timeout=PT30S",
                "jobqueue.metrics.enabled=false",
                "jobqueue.metrics.name-prefix=cms.jobs"
        ).run(ctx -> {
            var props = ctx.getBean(JobQueueProperties.class);
            assertEquals("cms_jobs", props.getTableName());
            assertFalse(props.getWorker().isEnabled());
            assertEquals(250, props.getWorker().getIntervalMs());
            assertEquals(5, props.getResilience().getMaxRetries());
            assertEquals(Duration.ofSeconds(10), props.getResilience().getCallTimeout());
            assertEquals(500, props.getResilience().getRetry().getInitialDelayMs());
            assertEquals(3.0, props.getResilience().getRetry().getMultiplier());
            assertEquals(20000, props.getResilience().getRetry().getMaxDelayMs());
            assertEquals(10, props.getResilience().getBreaker().getFailureThreshold());
            assertEquals(1, props.getResilience().getBreaker().getSuccessThreshold());
            assertEquals(Duration.ofSeconds(30), props.getResilience().getBreaker().getResetTimeout());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("cms.jobs", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(JobQueueProperties.class)
    static class PropsConfig {
    }
}
