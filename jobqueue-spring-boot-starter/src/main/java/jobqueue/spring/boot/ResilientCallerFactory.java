package jobqueue.spring.boot;

import jobqueue.resilience.CircuitBreakerRegistry;
import jobqueue.resilience.ExponentialBackoffRetryPolicy;
import jobqueue.resilience.ResilientCaller;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates one {@link ResilientCaller} per external dependency from {@link JobQueueProperties},
 * sharing the breakers of a {@link CircuitBreakerRegistry}.
 */
public class ResilientCallerFactory implements AutoCloseable {
    private final JobQueueProperties.Resilience props;
    private final CircuitBreakerRegistry breakers;
    private final Map<String, ResilientCaller> callers = new ConcurrentHashMap<>();

    public ResilientCallerFactory(JobQueueProperties.Resilience props, CircuitBreakerRegistry breakers) {
        this.props = props;
        this.breakers = breakers;
    }

    /**
     * Returns the caller for a dependency, creating it on first use.
     */
    public ResilientCaller caller(String dependency) {
        return callers.computeIfAbsent(dependency, name -> ResilientCaller.builder()
                .name(name)
                .circuitBreaker(breakers.breaker(name))
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        props.getRetry().getInitialDelayMs(),
                        props.getRetry().getMultiplier(),
                        props.getRetry().getMaxDelayMs()))
                .maxRetries(props.getMaxRetries())
                .callTimeout(props.getCallTimeout())
                .build());
    }

    @Override
    public void close() {
        callers.values().forEach(ResilientCaller::close);
        callers.clear();
    }
}
