package jobqueue.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot demo: content jobs enqueued over HTTP and run by the auto-configured worker.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/jobqueue-spring-boot-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST /jobs/generate          {"topic": "roofing"}             - enqueue GENERATE_CONTENT
 * POST /jobs/distribute        {"contentId": "p1", "channels": []} - enqueue DISTRIBUTE_CONTENT
 * POST /jobs/{type}            any JSON object                  - enqueue any job type
 * GET  /jobs/{id}                                               - job status and result
 * GET  /jobs/failed                                             - recent failed jobs
 * POST /jobs/{id}/retry                                         - re-enqueue a failed job
 * GET  /drafts                                                  - drafts saved so far
 *
 * <p>Without {@code AI_API_KEY} the generator runs in mock mode.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
