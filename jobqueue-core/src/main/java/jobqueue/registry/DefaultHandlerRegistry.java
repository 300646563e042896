package jobqueue.registry;

import jobqueue.JobHandler;
import jobqueue.JobType;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding exactly one handler per job type.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(ContentJobType.GENERATE_CONTENT, generateHandler)
 *     .register("REINDEX", payload -> search.reindex(payload));
 * }</pre>
 *
 * <p>Registering a second handler for a type that already has one throws
 * {@link IllegalStateException}.
 *
 * @see JobHandler
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers a handler for a type-safe job type.
   *
   * @param jobType the job type (enum or other JobType implementation)
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry register(JobType jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    return register(jobType.name(), handler);
  }

  /**
   * Registers a handler for a string job type.
   *
   * @param jobType the job type name
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for the type
   */
  public DefaultHandlerRegistry register(String jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(handler, "handler");
    if (jobType.isBlank()) {
      throw new IllegalArgumentException("jobType cannot be blank");
    }
    JobHandler existing = handlers.putIfAbsent(jobType, handler);
    if (existing != null) {
      throw new IllegalStateException("Handler already registered for job type: " + jobType);
    }
    return this;
  }

  @Override
  public JobHandler handlerFor(String jobType) {
    return jobType == null ? null : handlers.get(jobType);
  }

  @Override
  public Set<String> registeredTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }
}
