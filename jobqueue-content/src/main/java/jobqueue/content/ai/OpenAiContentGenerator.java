package jobqueue.content.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jobqueue.resilience.CircuitBreaker;
import jobqueue.resilience.ExternalServiceException;
import jobqueue.resilience.ResilientCaller;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ContentGenerator} backed by an OpenAI-compatible chat-completions API.
 *
 * <p>Each request goes through a {@link ResilientCaller}: non-2xx responses become
 * {@link ExternalServiceException}s carrying the HTTP status, so rate limits (429) and server
 * errors (5xx) are retried with backoff while other client errors fail at once. The model is
 * asked for a JSON object with {@code title}, {@code content}, {@code summary}, {@code tags},
 * {@code seoTitle} and {@code seoDescription}.
 *
 * <p>With no API key, or the key {@code "mock"}, the generator runs in mock mode and
 * delegates to a {@link MockContentGenerator} without any network access.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OpenAiContentGenerator generator = OpenAiContentGenerator.builder()
 *     .apiKey(System.getenv("AI_API_KEY"))
 *     .model("gpt-4-turbo-preview")
 *     .build();
 * }</pre>
 */
public final class OpenAiContentGenerator implements ContentGenerator, AutoCloseable {
  private static final Logger logger = Logger.getLogger(OpenAiContentGenerator.class.getName());

  public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
  public static final String DEFAULT_MODEL = "gpt-4-turbo-preview";
  static final String MOCK_KEY = "mock";

  private final String apiKey;
  private final URI completionsUri;
  private final String model;
  private final double temperature;
  private final HttpClient httpClient;
  private final ResilientCaller caller;
  private final boolean ownsCaller;
  private final ObjectMapper objectMapper;
  private final TokenUsageTracker tokenUsage;
  private final ContentGenerator mockGenerator;
  private final boolean fallbackToMockOnError;

  private OpenAiContentGenerator(Builder builder) {
    this.apiKey = builder.apiKey;
    String baseUrl = builder.baseUrl.endsWith("/")
        ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1) : builder.baseUrl;
    this.completionsUri = URI.create(baseUrl + "/chat/completions");
    this.model = Objects.requireNonNull(builder.model, "model");
    this.temperature = builder.temperature;
    this.httpClient = builder.httpClient != null ? builder.httpClient
        : HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    this.ownsCaller = builder.caller == null;
    this.caller = builder.caller != null ? builder.caller
        : ResilientCaller.builder().circuitBreaker(CircuitBreaker.builder("openai").build()).build();
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    this.tokenUsage = builder.tokenUsage != null ? builder.tokenUsage : new TokenUsageTracker();
    this.mockGenerator = builder.mockGenerator != null ? builder.mockGenerator : new MockContentGenerator();
    this.fallbackToMockOnError = builder.fallbackToMockOnError;

    if (isMockMode()) {
      logger.warning("No AI API key configured; content generation runs in mock mode");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns {@code true} when no real API key is configured.
   */
  public boolean isMockMode() {
    return apiKey == null || apiKey.isBlank() || MOCK_KEY.equals(apiKey);
  }

  public TokenUsageTracker tokenUsage() {
    return tokenUsage;
  }

  @Override
  public GeneratedContent generate(String topic) throws Exception {
    if (isMockMode()) {
      return mockGenerator.generate(topic);
    }
    logger.info("Generating content for topic: " + topic);
    try {
      String body = caller.call(() -> send(requestBody(topic)));
      return parse(body);
    } catch (Exception e) {
      if (!fallbackToMockOnError) {
        throw e;
      }
      logger.log(Level.WARNING, "Content generation failed, falling back to mock content", e);
      return mockGenerator.generate(topic);
    }
  }

  private String requestBody(String topic) throws IOException {
    String prompt = "Write a comprehensive, SEO-optimized blog post about \"" + topic + "\".\n"
        + "Include: title, detailed HTML content (with h2/p tags), summary, relevant tags, "
        + "seoTitle, and seoDescription.\n"
        + "Return valid JSON only.";
    ObjectNode root = objectMapper.createObjectNode();
    root.put("model", model);
    ObjectNode message = root.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", prompt);
    root.putObject("response_format").put("type", "json_object");
    root.put("temperature", temperature);
    return objectMapper.writeValueAsString(root);
  }

  private String send(String requestBody) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(completionsUri)
        .header("Content-Type", "application/json")
        .header("Authorization", "Bearer " + apiKey)
        .POST(HttpRequest.BodyPublishers.ofString(requestBody))
        .build();
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ExternalServiceException(
          "OpenAI API Error (" + status + "): " + errorMessage(response.body()), status);
    }
    return response.body();
  }

  private String errorMessage(String body) {
    try {
      JsonNode message = objectMapper.readTree(body).path("error").path("message");
      if (message.isTextual() && !message.asText().isBlank()) {
        return message.asText();
      }
    } catch (IOException | RuntimeException e) {
      logger.log(Level.FINE, "Unparseable error body", e);
    }
    return "request failed";
  }

  GeneratedContent parse(String responseBody) throws IOException {
    JsonNode root = objectMapper.readTree(responseBody);
    JsonNode usage = root.path("usage");
    if (usage.isObject()) {
      tokenUsage.record(
          usage.path("prompt_tokens").asLong(0),
          usage.path("completion_tokens").asLong(0),
          usage.path("total_tokens").asLong(0));
    }
    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (!content.isTextual()) {
      throw new ExternalServiceException("OpenAI response contained no message content", 200);
    }
    JsonNode result = objectMapper.readTree(content.asText());
    String title = text(result, "title");
    String seoDescription = text(result, "seoDescription");
    String summary = text(result, "summary");
    String seoTitle = text(result, "seoTitle");
    List<String> tags = new ArrayList<>();
    for (JsonNode tag : result.path("tags")) {
      if (tag.isTextual()) {
        tags.add(tag.asText());
      }
    }
    return new GeneratedContent(
        title,
        text(result, "content"),
        summary != null ? summary : seoDescription,
        tags,
        seoTitle != null ? seoTitle : title,
        seoDescription);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  /**
   * Closes the internally created {@link ResilientCaller}, if any.
   */
  @Override
  public void close() {
    if (ownsCaller) {
      caller.close();
    }
  }

  /**
   * Builder for {@link OpenAiContentGenerator}.
   */
  public static final class Builder {
    private String apiKey;
    private String baseUrl = DEFAULT_BASE_URL;
    private String model = DEFAULT_MODEL;
    private double temperature = 0.7;
    private HttpClient httpClient;
    private ResilientCaller caller;
    private ObjectMapper objectMapper;
    private TokenUsageTracker tokenUsage;
    private ContentGenerator mockGenerator;
    private boolean fallbackToMockOnError;

    private Builder() {
    }

    /**
     * Sets the API key. Optional; {@code null}, blank or {@code "mock"} selects mock mode.
     */
    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    /**
     * Sets the API base URL. Optional; defaults to {@code https://api.openai.com/v1}.
     */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      return this;
    }

    /**
     * Sets the model name. Optional; defaults to {@code gpt-4-turbo-preview}.
     */
    public Builder model(String model) {
      this.model = model;
      return this;
    }

    /**
     * Sets the sampling temperature. Optional; defaults to {@code 0.7}.
     */
    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    /**
     * Sets the HTTP client. Optional; defaults to a client with a 10 second connect timeout.
     */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /**
     * Sets the caller providing timeout, retry and circuit breaking.
     *
     * <p>Optional. Defaults to a caller with default settings and its own {@code openai}
     * breaker, closed together with this generator.
     */
    public Builder resilientCaller(ResilientCaller caller) {
      this.caller = caller;
      return this;
    }

    /**
     * Sets the Jackson mapper. Optional.
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * Sets the token usage tracker. Optional.
     */
    public Builder tokenUsage(TokenUsageTracker tokenUsage) {
      this.tokenUsage = tokenUsage;
      return this;
    }

    /**
     * Sets the generator used in mock mode and as the fallback. Optional; defaults to
     * {@link MockContentGenerator}.
     */
    public Builder mockGenerator(ContentGenerator mockGenerator) {
      this.mockGenerator = mockGenerator;
      return this;
    }

    /**
     * Returns mock content instead of failing when the provider call fails for good.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder fallbackToMockOnError(boolean fallbackToMockOnError) {
      this.fallbackToMockOnError = fallbackToMockOnError;
      return this;
    }

    public OpenAiContentGenerator build() {
      return new OpenAiContentGenerator(this);
    }
  }
}
