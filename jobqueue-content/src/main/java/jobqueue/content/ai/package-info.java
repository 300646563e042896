/**
 * AI content generation.
 *
 * <p>{@link jobqueue.content.ai.OpenAiContentGenerator} calls an OpenAI-compatible
 * chat-completions endpoint through a {@link jobqueue.resilience.ResilientCaller} and falls
 * back to {@link jobqueue.content.ai.MockContentGenerator} when no API key is configured.
 */
package jobqueue.content.ai;
