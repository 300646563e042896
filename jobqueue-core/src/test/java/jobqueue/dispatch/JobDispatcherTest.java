package jobqueue.dispatch;

import jobqueue.model.Job;
import jobqueue.model.JobStatus;
import jobqueue.registry.DefaultHandlerRegistry;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.RecordingMetricsExporter;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobDispatcherTest {

    private static ConnectionProvider stubCp() {
        return () -> (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> null);
    }

    private static Job processing(String id, String type, String payloadJson) {
        return new Job(id, type, payloadJson, JobStatus.PROCESSING, 1, Instant.now(),
                null, null, Instant.now(), null);
    }

    private JobDispatcher newDispatcher(StubJobStore store, DefaultHandlerRegistry registry) {
        return JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(store)
                .handlerRegistry(registry)
                .build();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingCollaborators() {
        assertThrows(NullPointerException.class, () ->
                JobDispatcher.builder()
                        .jobStore(new StubJobStore())
                        .handlerRegistry(new DefaultHandlerRegistry())
                        .build());
        assertThrows(NullPointerException.class, () ->
                JobDispatcher.builder()
                        .connectionProvider(stubCp())
                        .handlerRegistry(new DefaultHandlerRegistry())
                        .build());
        assertThrows(NullPointerException.class, () ->
                JobDispatcher.builder()
                        .connectionProvider(stubCp())
                        .jobStore(new StubJobStore())
                        .build());
    }

    // ── Outcomes ────────────────────────────────────────────────────

    @Test
    void completesJobWithEncodedResult() {
        StubJobStore store = new StubJobStore();
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> {
                    seen.set(payload);
                    return Map.of("title", payload.get("topic"));
                });

        DispatchOutcome outcome = newDispatcher(store, registry)
                .dispatch(processing("job-1", "ECHO", "{\"topic\":\"x\"}"));

        assertEquals(DispatchOutcome.COMPLETED, outcome);
        assertEquals("x", seen.get().get("topic"));
        assertEquals("{\"title\":\"x\"}", store.results.get("job-1"));
        assertEquals(0, store.markFailedCount.get());
    }

    @Test
    void nullResultIsStoredAsEmptyObject() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("VOID", payload -> null);

        newDispatcher(store, registry).dispatch(processing("job-1", "VOID", "{}"));

        assertEquals("{}", store.results.get("job-1"));
    }

    @Test
    void unknownTypeFailsWithoutInvokingAnyHandler() {
        StubJobStore store = new StubJobStore();
        AtomicInteger invoked = new AtomicInteger();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("KNOWN", payload -> invoked.incrementAndGet());

        DispatchOutcome outcome = newDispatcher(store, registry)
                .dispatch(processing("job-1", "FOO", "{}"));

        assertEquals(DispatchOutcome.UNKNOWN_TYPE, outcome);
        assertEquals("unknown job type: FOO", store.errors.get("job-1"));
        assertEquals(0, invoked.get());
        assertEquals(0, store.markCompletedCount.get());
    }

    @Test
    void handlerExceptionMessageIsRecorded() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("BOOM", payload -> {
                    throw new IllegalStateException("AI generation returned invalid content");
                });

        DispatchOutcome outcome = newDispatcher(store, registry)
                .dispatch(processing("job-1", "BOOM", "{}"));

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertEquals("AI generation returned invalid content", store.errors.get("job-1"));
    }

    @Test
    void exceptionWithoutMessageRecordsClassName() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("NPE", payload -> {
                    throw new NullPointerException();
                });

        newDispatcher(store, registry).dispatch(processing("job-1", "NPE", "{}"));

        assertEquals("java.lang.NullPointerException", store.errors.get("job-1"));
    }

    @Test
    void handlerErrorFailsTheJob() {
        StubJobStore store = new StubJobStore();
        AtomicReference<Throwable> seenByInterceptor = new AtomicReference<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("BOOM", payload -> {
                    throw new AssertionError("handler bug");
                });
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(store)
                .handlerRegistry(registry)
                .interceptor(JobInterceptor.after((job, error) -> seenByInterceptor.set(error)))
                .build();

        DispatchOutcome outcome = dispatcher.dispatch(processing("job-1", "BOOM", "{}"));

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertEquals("handler bug", store.errors.get("job-1"));
        assertInstanceOf(AssertionError.class, seenByInterceptor.get());
        assertEquals(0, store.markCompletedCount.get());
    }

    @Test
    void stackOverflowInHandlerFailsTheJob() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("DEEP", payload -> {
                    throw new StackOverflowError();
                });

        DispatchOutcome outcome = newDispatcher(store, registry)
                .dispatch(processing("job-1", "DEEP", "{}"));

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertEquals("java.lang.StackOverflowError", store.errors.get("job-1"));
    }

    @Test
    void outOfMemoryIsRethrownAfterTheJobIsMarkedFailed() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("HUGE", payload -> {
                    throw new OutOfMemoryError("heap");
                });

        assertThrows(OutOfMemoryError.class, () -> newDispatcher(store, registry)
                .dispatch(processing("job-1", "HUGE", "{}")));
        assertEquals("heap", store.errors.get("job-1"));
    }

    @Test
    void malformedPayloadFailsTheJob() {
        StubJobStore store = new StubJobStore();
        AtomicInteger invoked = new AtomicInteger();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> invoked.incrementAndGet());

        DispatchOutcome outcome = newDispatcher(store, registry)
                .dispatch(processing("job-1", "ECHO", "[1,2]"));

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertEquals(0, invoked.get());
        assertNotNull(store.errors.get("job-1"));
    }

    @Test
    void storeFailureDuringStatusUpdateDoesNotEscape() {
        StubJobStore store = new StubJobStore() {
            @Override
            public int markCompleted(Connection conn, String jobId, String resultJson) {
                throw new IllegalStateException("db down");
            }
        };
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> "ok");

        assertDoesNotThrow(() -> newDispatcher(store, registry)
                .dispatch(processing("job-1", "ECHO", "{}")));
    }

    @Test
    void connectionFailureDuringStatusUpdateDoesNotEscape() {
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> "ok");
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(() -> {
                    throw new SQLException("pool exhausted");
                })
                .jobStore(new StubJobStore())
                .handlerRegistry(registry)
                .build();

        assertEquals(DispatchOutcome.COMPLETED,
                dispatcher.dispatch(processing("job-1", "ECHO", "{}")));
    }

    // ── Interceptors and metrics ────────────────────────────────────

    @Test
    void interceptorsRunAroundHandlerInOrder() {
        List<String> calls = new ArrayList<>();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> {
                    calls.add("handler");
                    return null;
                });
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(new StubJobStore())
                .handlerRegistry(registry)
                .interceptor(new JobInterceptor() {
                    @Override
                    public void beforeDispatch(Job job) {
                        calls.add("before-1");
                    }

                    @Override
                    public void afterDispatch(Job job, Throwable error) {
                        calls.add("after-1");
                    }
                })
                .interceptor(new JobInterceptor() {
                    @Override
                    public void beforeDispatch(Job job) {
                        calls.add("before-2");
                    }

                    @Override
                    public void afterDispatch(Job job, Throwable error) {
                        calls.add("after-2");
                    }
                })
                .build();

        dispatcher.dispatch(processing("job-1", "ECHO", "{}"));

        assertEquals(List.of("before-1", "before-2", "handler", "after-2", "after-1"), calls);
    }

    @Test
    void failingBeforeHookSkipsHandlerAndFailsJob() {
        StubJobStore store = new StubJobStore();
        AtomicInteger invoked = new AtomicInteger();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> invoked.incrementAndGet());
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(store)
                .handlerRegistry(registry)
                .interceptor(JobInterceptor.before(job -> {
                    throw new IllegalStateException("quota exceeded");
                }))
                .build();

        assertEquals(DispatchOutcome.FAILED, dispatcher.dispatch(processing("job-1", "ECHO", "{}")));
        assertEquals(0, invoked.get());
        assertEquals("quota exceeded", store.errors.get("job-1"));
    }

    @Test
    void afterHookFailureIsSwallowed() {
        StubJobStore store = new StubJobStore();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("ECHO", payload -> "ok");
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(store)
                .handlerRegistry(registry)
                .interceptor(JobInterceptor.after((job, error) -> {
                    throw new RuntimeException("audit sink down");
                }))
                .build();

        assertEquals(DispatchOutcome.COMPLETED, dispatcher.dispatch(processing("job-1", "ECHO", "{}")));
        assertEquals(1, store.markCompletedCount.get());
    }

    @Test
    void metricsReflectOutcomes() {
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
                .register("OK", payload -> "ok")
                .register("BAD", payload -> {
                    throw new Exception("bad");
                });
        JobDispatcher dispatcher = JobDispatcher.builder()
                .connectionProvider(stubCp())
                .jobStore(new StubJobStore())
                .handlerRegistry(registry)
                .metrics(metrics)
                .build();

        dispatcher.dispatch(processing("1", "OK", "{}"));
        dispatcher.dispatch(processing("2", "BAD", "{}"));
        dispatcher.dispatch(processing("3", "NOPE", "{}"));

        assertEquals(1, metrics.completed.get());
        assertEquals(1, metrics.failed.get());
        assertEquals(1, metrics.unknownType.get());
        assertEquals(List.of("OK", "BAD", "NOPE"), metrics.timedTypes);
    }
}
