package jobqueue.resilience;

/**
 * Pauses the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
