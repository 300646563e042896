package jobqueue.dispatch;

import jobqueue.model.Job;
import jobqueue.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal JobStore stub for unit tests that don't need real JDBC. Records the last terminal
 * update per job.
 */
class StubJobStore implements JobStore {
  final AtomicInteger markCompletedCount = new AtomicInteger();
  final AtomicInteger markFailedCount = new AtomicInteger();
  final Map<String, String> results = new ConcurrentHashMap<>();
  final Map<String, String> errors = new ConcurrentHashMap<>();

  @Override
  public void insertNew(Connection conn, Job job) {}

  @Override
  public Optional<Job> claimNext(Connection conn, Instant now) {
    return Optional.empty();
  }

  @Override
  public int markCompleted(Connection conn, String jobId, String resultJson) {
    markCompletedCount.incrementAndGet();
    results.put(jobId, resultJson);
    return 1;
  }

  @Override
  public int markFailed(Connection conn, String jobId, String error) {
    markFailedCount.incrementAndGet();
    errors.put(jobId, error);
    return 1;
  }

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    return Optional.empty();
  }
}
