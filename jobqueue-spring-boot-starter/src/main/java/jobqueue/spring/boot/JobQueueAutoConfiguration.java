package jobqueue.spring.boot;

import jobqueue.JobClient;
import jobqueue.JobEngine;
import jobqueue.admin.JobAdmin;
import jobqueue.dispatch.JobInterceptor;
import jobqueue.jdbc.DataSourceConnectionProvider;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.JdbcJobStores;
import jobqueue.registry.DefaultHandlerRegistry;
import jobqueue.resilience.CircuitBreaker;
import jobqueue.resilience.CircuitBreakerRegistry;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.JacksonJsonCodec;
import jobqueue.util.JsonCodec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the job queue.
 *
 * <p>Wires a {@link JobEngine} from a {@link DataSource} and {@link JobQueueProperties}, and
 * exposes its {@link JobClient} and {@link JobAdmin}. The worker is started by
 * {@link JobEngineLifecycle} unless {@code jobqueue.worker.enabled=false}.
 *
 * @see JobQueueProperties
 * @see JobQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, JobQueueProperties props) {
    return JdbcJobStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobHandlerRegistrar jobHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry) {
    return new JobHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public CircuitBreakerRegistry circuitBreakerRegistry(JobQueueProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    JobQueueProperties.Breaker breaker = props.getResilience().getBreaker();
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return new CircuitBreakerRegistry(name -> CircuitBreaker.builder(name)
        .failureThreshold(breaker.getFailureThreshold())
        .successThreshold(breaker.getSuccessThreshold())
        .resetTimeout(breaker.getResetTimeout())
        .metrics(metrics)
        .build());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ResilientCallerFactory resilientCallerFactory(JobQueueProperties props,
      CircuitBreakerRegistry circuitBreakerRegistry) {
    return new ResilientCallerFactory(props.getResilience(), circuitBreakerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public JobEngine jobEngine(JobQueueProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      DefaultHandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ObjectMapper> objectMapperProvider,
      ObjectProvider<JobInterceptor> interceptorProvider) {

    var builder = JobEngine.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .handlerRegistry(handlerRegistry)
        .intervalMs(props.getWorker().getIntervalMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    ObjectMapper objectMapper = objectMapperProvider.getIfAvailable();
    JsonCodec codec = objectMapper != null ? new JacksonJsonCodec(objectMapper) : JsonCodec.getDefault();
    builder.jsonCodec(codec);
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "jobqueue.worker", name = "enabled", matchIfMissing = true)
  public JobEngineLifecycle jobEngineLifecycle(JobEngine jobEngine) {
    return new JobEngineLifecycle(jobEngine);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobClient jobClient(JobEngine jobEngine) {
    return jobEngine.client();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobAdmin jobAdmin(JobEngine jobEngine) {
    return jobEngine.admin();
  }
}
