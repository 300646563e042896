package jobqueue.spring.boot;

import jobqueue.JobEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the engine's worker with the Spring container and stops it on shutdown.
 *
 * <p>Stopping does not close the worker, so the context can be started again. The engine
 * itself is closed when its bean is destroyed.
 */
public class JobEngineLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobEngineLifecycle.class);

    private final JobEngine engine;
    private volatile boolean running = false;

    public JobEngineLifecycle(JobEngine engine) {
        this.engine = engine;
    }

    @Override
    public void start() {
        engine.start();
        running = true;
        log.info("Job worker started");
    }

    @Override
    public void stop() {
        engine.worker().stop();
        running = false;
        log.info("Job worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
