package jobqueue.resilience;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void baseDelayGrowsExponentiallyUntilCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000);

    assertEquals(1000, policy.baseDelayMs(0));
    assertEquals(2000, policy.baseDelayMs(1));
    assertEquals(4000, policy.baseDelayMs(2));
    assertEquals(8000, policy.baseDelayMs(3));
    assertEquals(10_000, policy.baseDelayMs(4));
    assertEquals(10_000, policy.baseDelayMs(10));
  }

  @Test
  void delayStaysWithinJitterBoundsForFirstElevenAttempts() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000);

    for (int attempt = 0; attempt <= 10; attempt++) {
      long base = policy.baseDelayMs(attempt);
      for (int sample = 0; sample < 200; sample++) {
        long delay = policy.computeDelayMs(attempt);
        assertTrue(delay >= 0, "negative delay at attempt " + attempt);
        assertTrue(delay <= 12_000, "delay above 1.2 * maxDelay at attempt " + attempt + ": " + delay);
        assertTrue(delay >= Math.floor(base * 0.8), "delay below -20% at attempt " + attempt + ": " + delay);
        assertTrue(delay <= base * 1.2, "delay above +20% at attempt " + attempt + ": " + delay);
      }
    }
  }

  @Test
  void lowestRandomGivesMinusTwentyPercent() {
    ExponentialBackoffRetryPolicy policy =
        new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000, 0.2, () -> 0.0);

    assertEquals(800, policy.computeDelayMs(0));
    assertEquals(8000, policy.computeDelayMs(10));
  }

  @Test
  void midpointRandomGivesBaseDelay() {
    ExponentialBackoffRetryPolicy policy =
        new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000, 0.2, () -> 0.5);

    assertEquals(1000, policy.computeDelayMs(0));
    assertEquals(4000, policy.computeDelayMs(2));
  }

  @Test
  void highestRandomStaysBelowPlusTwentyPercent() {
    ExponentialBackoffRetryPolicy policy =
        new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000, 0.2, () -> 0.999_999);

    assertEquals(1199, policy.computeDelayMs(0));
    assertEquals(11_999, policy.computeDelayMs(7));
  }

  @Test
  void hugeAttemptDoesNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000);

    assertEquals(10_000, policy.baseDelayMs(5_000));
    long delay = policy.computeDelayMs(5_000);
    assertTrue(delay >= 8000 && delay <= 12_000, "got: " + delay);
  }

  @Test
  void negativeAttemptReturnsZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000);

    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 2.0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1, 0.5, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1, 2.0, -1));
  }
}
