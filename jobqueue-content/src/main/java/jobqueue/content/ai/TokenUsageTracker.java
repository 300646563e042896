package jobqueue.content.ai;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Accumulates token usage reported by the AI provider and estimates its cost.
 *
 * <p>Prices are per 1000 tokens. Defaults are {@code 0.01} for prompt tokens and
 * {@code 0.03} for completion tokens.
 */
public final class TokenUsageTracker {
  private static final Logger logger = Logger.getLogger(TokenUsageTracker.class.getName());

  public static final double DEFAULT_PROMPT_PRICE_PER_1K = 0.01;
  public static final double DEFAULT_COMPLETION_PRICE_PER_1K = 0.03;

  private final double promptPricePer1k;
  private final double completionPricePer1k;
  private TokenUsage total = TokenUsage.ZERO;

  public TokenUsageTracker() {
    this(DEFAULT_PROMPT_PRICE_PER_1K, DEFAULT_COMPLETION_PRICE_PER_1K);
  }

  public TokenUsageTracker(double promptPricePer1k, double completionPricePer1k) {
    if (promptPricePer1k < 0 || completionPricePer1k < 0) {
      throw new IllegalArgumentException("prices must be >= 0");
    }
    this.promptPricePer1k = promptPricePer1k;
    this.completionPricePer1k = completionPricePer1k;
  }

  /**
   * Records the usage of one call.
   *
   * @return the usage of this call, with its estimated cost
   */
  public TokenUsage record(long promptTokens, long completionTokens, long totalTokens) {
    double cost = (promptTokens / 1000.0) * promptPricePer1k
        + (completionTokens / 1000.0) * completionPricePer1k;
    TokenUsage usage = new TokenUsage(promptTokens, completionTokens, totalTokens, cost);
    synchronized (this) {
      total = total.plus(usage);
    }
    logger.info(String.format(Locale.ROOT, "Tokens: %d (prompt: %d, completion: %d), cost: $%.4f",
        totalTokens, promptTokens, completionTokens, cost));
    return usage;
  }

  public synchronized TokenUsage total() {
    return total;
  }
}
