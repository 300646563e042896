package jobqueue.resilience;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds one {@link CircuitBreaker} per protected dependency for the life of the process.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(name ->
 *     CircuitBreaker.builder(name).failureThreshold(5).resetTimeout(Duration.ofMinutes(1)).build());
 *
 * CircuitBreaker openAi = breakers.breaker("openai");
 * }</pre>
 */
public final class CircuitBreakerRegistry {
  private final Function<String, CircuitBreaker> factory;
  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

  /**
   * Creates a registry whose breakers all use the builder defaults.
   */
  public CircuitBreakerRegistry() {
    this(name -> CircuitBreaker.builder(name).build());
  }

  /**
   * @param factory creates the breaker for a dependency name on first lookup
   */
  public CircuitBreakerRegistry(Function<String, CircuitBreaker> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Returns the breaker for a dependency, creating it on first use.
   *
   * @param name the dependency name
   * @return the breaker, same instance on every call with the same name
   */
  public CircuitBreaker breaker(String name) {
    Objects.requireNonNull(name, "name");
    return breakers.computeIfAbsent(name, factory);
  }

  public Collection<CircuitBreaker> all() {
    return Collections.unmodifiableCollection(breakers.values());
  }
}
