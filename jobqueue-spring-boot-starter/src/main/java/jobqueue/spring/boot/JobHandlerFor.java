package jobqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for a job type.
 *
 * <p>The annotated bean must implement {@link jobqueue.JobHandler}.
 *
 * <pre>{@code
 * @Component
 * @JobHandlerFor("GENERATE_CONTENT")
 * public class GenerateHandler implements JobHandler {
 *   public Object handle(Map<String, Object> payload) { ... }
 * }
 * }</pre>
 *
 * @see JobHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobHandlerFor {

    /**
     * Job type name.
     */
    String value();
}
