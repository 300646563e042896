package jobqueue.admin;

import jobqueue.model.Job;
import jobqueue.model.JobStatus;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobAdminTest {

  private static ConnectionProvider dummyProvider() {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  private static ConnectionProvider failingProvider() {
    return () -> { throw new SQLException("connection failed"); };
  }

  private static Job job(String id, JobStatus status) {
    return new Job(id, "GENERATE_CONTENT", "{\"topic\":\"x\"}", status, 1, Instant.now(),
        null, status == JobStatus.FAILED ? "boom" : null, Instant.now(), null);
  }

  /** Store backed by a fixed list of jobs. */
  private static class ListStore implements JobStore {
    final List<Job> jobs = new ArrayList<>();
    final List<Job> inserted = new ArrayList<>();
    final AtomicReference<Instant> stuckCutoff = new AtomicReference<>();

    @Override
    public void insertNew(Connection conn, Job job) {
      inserted.add(job);
    }

    @Override
    public Optional<Job> claimNext(Connection conn, Instant now) {
      return Optional.empty();
    }

    @Override
    public int markCompleted(Connection conn, String jobId, String resultJson) {
      return 0;
    }

    @Override
    public int markFailed(Connection conn, String jobId, String error) {
      return 0;
    }

    @Override
    public Optional<Job> findById(Connection conn, String jobId) {
      return jobs.stream().filter(j -> j.id().equals(jobId)).findFirst();
    }

    @Override
    public List<Job> queryByStatus(Connection conn, JobStatus status, int limit) {
      return jobs.stream().filter(j -> j.status() == status).limit(limit).toList();
    }

    @Override
    public List<Job> queryStuck(Connection conn, Instant lockedBefore, int limit) {
      stuckCutoff.set(lockedBefore);
      return queryByStatus(conn, JobStatus.PROCESSING, limit);
    }

    @Override
    public int countByStatus(Connection conn, JobStatus status) {
      return (int) jobs.stream().filter(j -> j.status() == status).count();
    }
  }

  @Test
  void queryFailedDelegatesToStore() {
    ListStore store = new ListStore();
    store.jobs.add(job("f-1", JobStatus.FAILED));
    store.jobs.add(job("c-1", JobStatus.COMPLETED));
    JobAdmin admin = new JobAdmin(dummyProvider(), store);

    List<Job> failed = admin.queryFailed(10);

    assertEquals(1, failed.size());
    assertEquals("f-1", failed.get(0).id());
  }

  @Test
  void queryStuckUsesCutoffInThePast() {
    ListStore store = new ListStore();
    store.jobs.add(job("p-1", JobStatus.PROCESSING));
    JobAdmin admin = new JobAdmin(dummyProvider(), store);

    List<Job> stuck = admin.queryStuck(Duration.ofMinutes(10), 5);

    assertEquals(1, stuck.size());
    assertTrue(store.stuckCutoff.get().isBefore(Instant.now().minus(Duration.ofMinutes(9))));
  }

  @Test
  void countDelegatesToStore() {
    ListStore store = new ListStore();
    store.jobs.add(job("f-1", JobStatus.FAILED));
    store.jobs.add(job("f-2", JobStatus.FAILED));
    JobAdmin admin = new JobAdmin(dummyProvider(), store);

    assertEquals(2, admin.count(JobStatus.FAILED));
    assertEquals(0, admin.count(JobStatus.PENDING));
  }

  @Test
  void reEnqueueCopiesFailedJobUnderNewId() {
    ListStore store = new ListStore();
    store.jobs.add(job("f-1", JobStatus.FAILED));
    JobAdmin admin = new JobAdmin(dummyProvider(), store);

    Optional<String> newId = admin.reEnqueue("f-1");

    assertTrue(newId.isPresent());
    assertNotEquals("f-1", newId.get());
    Job copy = store.inserted.get(0);
    assertEquals(newId.get(), copy.id());
    assertEquals(JobStatus.PENDING, copy.status());
    assertEquals("GENERATE_CONTENT", copy.type());
    assertEquals("{\"topic\":\"x\"}", copy.payloadJson());
    assertEquals(0, copy.attempts());
  }

  @Test
  void reEnqueueIgnoresJobsThatAreNotFailed() {
    ListStore store = new ListStore();
    store.jobs.add(job("c-1", JobStatus.COMPLETED));
    JobAdmin admin = new JobAdmin(dummyProvider(), store);

    assertTrue(admin.reEnqueue("c-1").isEmpty());
    assertTrue(admin.reEnqueue("missing").isEmpty());
    assertTrue(store.inserted.isEmpty());
  }

  @Test
  void connectionFailuresReturnEmptyResults() {
    JobAdmin admin = new JobAdmin(failingProvider(), new ListStore());

    assertTrue(admin.queryFailed(10).isEmpty());
    assertTrue(admin.queryStuck(Duration.ofMinutes(1), 10).isEmpty());
    assertEquals(0, admin.count(JobStatus.FAILED));
    assertTrue(admin.reEnqueue("x").isEmpty());
  }
}
