package jobqueue.content.ai;

/**
 * Token counts and estimated cost, for one call or accumulated.
 */
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens,
    double estimatedCost) {

  public static final TokenUsage ZERO = new TokenUsage(0, 0, 0, 0.0);

  TokenUsage plus(TokenUsage other) {
    return new TokenUsage(
        promptTokens + other.promptTokens,
        completionTokens + other.completionTokens,
        totalTokens + other.totalTokens,
        estimatedCost + other.estimatedCost);
  }
}
