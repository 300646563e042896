package jobqueue.dispatch;

import jobqueue.model.Job;

/**
 * Cross-cutting hook around handler invocation.
 *
 * <p>Interceptors run around the handler:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the handler is skipped and the job is marked FAILED
 * with that exception's message. {@code afterDispatch} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * JobDispatcher.builder()
 *     .interceptor(JobInterceptor.before(job ->
 *         audit.log(job.type(), job.id())))
 *     .interceptor(JobInterceptor.after((job, error) -> {
 *         if (error != null) alerts.notify(job.id());
 *     }))
 *     .build();
 * }</pre>
 */
public interface JobInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @param job the claimed job
     * @throws Exception to skip the handler and fail the job
     */
    default void beforeDispatch(Job job) throws Exception {
    }

    /**
     * Called after handler invocation (or after a beforeDispatch failure).
     *
     * @param job   the claimed job
     * @param error null on success, the exception or error thrown on failure
     */
    default void afterDispatch(Job job, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static JobInterceptor before(BeforeHook hook) {
        return new JobInterceptor() {
            @Override
            public void beforeDispatch(Job job) throws Exception {
                hook.accept(job);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static JobInterceptor after(AfterHook hook) {
        return new JobInterceptor() {
            @Override
            public void afterDispatch(Job job, Throwable error) {
                hook.accept(job, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Job job) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Job job, Throwable error);
    }
}
