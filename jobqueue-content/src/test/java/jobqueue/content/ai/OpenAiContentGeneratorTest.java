package jobqueue.content.ai;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import jobqueue.resilience.CircuitBreaker;
import jobqueue.resilience.CircuitOpenException;
import jobqueue.resilience.CircuitState;
import jobqueue.resilience.ExternalServiceException;
import jobqueue.resilience.ResilientCaller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.*;

class OpenAiContentGeneratorTest {
  private static final String COMPLETIONS = "/v1/chat/completions";
  private static final String COMPLETION = "{"
      + "\"choices\":[{\"message\":{\"content\":"
      + "\"{\\\"title\\\":\\\"Roofing 101\\\",\\\"content\\\":\\\"<p>Roofs</p>\\\","
      + "\\\"tags\\\":[\\\"roof\\\"],\\\"seoDescription\\\":\\\"All about roofs\\\"}\"}}],"
      + "\"usage\":{\"prompt_tokens\":1000,\"completion_tokens\":2000,\"total_tokens\":3000}}";

  private WireMockServer wireMockServer;
  private ResilientCaller caller;

  @BeforeEach
  void setUp() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
    caller = newCaller(CircuitBreaker.builder("openai").build(), 2);
  }

  @AfterEach
  void tearDown() {
    caller.close();
    if (wireMockServer.isRunning()) {
      wireMockServer.resetAll();
      wireMockServer.stop();
    }
  }

  private static ResilientCaller newCaller(CircuitBreaker breaker, int maxRetries) {
    return ResilientCaller.builder()
        .circuitBreaker(breaker)
        .maxRetries(maxRetries)
        .callTimeout(Duration.ofSeconds(5))
        .sleeper(ms -> { })
        .build();
  }

  private OpenAiContentGenerator generator(String apiKey, boolean fallback) {
    return generator(apiKey, fallback, caller);
  }

  private OpenAiContentGenerator generator(String apiKey, boolean fallback, ResilientCaller resilientCaller) {
    return OpenAiContentGenerator.builder()
        .apiKey(apiKey)
        .baseUrl(wireMockServer.baseUrl() + "/v1/")
        .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
        .resilientCaller(resilientCaller)
        .fallbackToMockOnError(fallback)
        .build();
  }

  private void stubCompletions(int status, String body) {
    wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS))
        .willReturn(aResponse()
            .withStatus(status)
            .withHeader("Content-Type", "application/json")
            .withBody(body)));
  }

  private void stubSequence(String scenario, int[] statuses, String[] bodies) {
    String state = Scenario.STARTED;
    for (int i = 0; i < statuses.length; i++) {
      String next = "attempt-" + (i + 2);
      wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS))
          .inScenario(scenario)
          .whenScenarioStateIs(state)
          .willReturn(aResponse()
              .withStatus(statuses[i])
              .withHeader("Content-Type", "application/json")
              .withBody(bodies[i]))
          .willSetStateTo(next));
      state = next;
    }
  }

  private void verifyRequests(int count) {
    wireMockServer.verify(count, postRequestedFor(urlEqualTo(COMPLETIONS)));
  }

  @Test
  void parsesCompletionAndTracksTokens() throws Exception {
    wireMockServer.stubFor(post(urlEqualTo(COMPLETIONS))
        .withHeader("Authorization", equalTo("Bearer sk-test"))
        .withRequestBody(containing("\"json_object\""))
        .withRequestBody(containing("roofing"))
        .willReturn(aResponse()
            .withStatus(200)
            .withHeader("Content-Type", "application/json")
            .withBody(COMPLETION)));
    OpenAiContentGenerator generator = generator("sk-test", false);

    GeneratedContent content = generator.generate("roofing");

    assertEquals("Roofing 101", content.title());
    assertEquals("<p>Roofs</p>", content.content());
    assertEquals(List.of("roof"), content.tags());
    assertEquals("Roofing 101", content.seoTitle());
    assertEquals("All about roofs", content.summary());
    verifyRequests(1);

    TokenUsage total = generator.tokenUsage().total();
    assertEquals(3000, total.totalTokens());
    assertEquals(0.07, total.estimatedCost(), 1e-9);
  }

  @Test
  void retriesServerErrorsAndRateLimits() throws Exception {
    stubSequence("recovering",
        new int[] {503, 429, 200},
        new String[] {"{\"error\":{\"message\":\"overloaded\"}}", "{}", COMPLETION});

    GeneratedContent content = generator("sk-test", false).generate("roofing");

    assertEquals("Roofing 101", content.title());
    verifyRequests(3);
  }

  @Test
  void clientErrorIsNotRetried() {
    stubCompletions(401, "{\"error\":{\"message\":\"bad key\"}}");

    ExternalServiceException ex = assertThrows(ExternalServiceException.class,
        () -> generator("sk-test", false).generate("roofing"));

    assertEquals(401, ex.statusCode());
    assertEquals("OpenAI API Error (401): bad key", ex.getMessage());
    verifyRequests(1);
  }

  @Test
  void exhaustedRetriesSurfaceLastError() {
    stubCompletions(500, "{}");

    ExternalServiceException ex = assertThrows(ExternalServiceException.class,
        () -> generator("sk-test", false).generate("roofing"));

    assertEquals(500, ex.statusCode());
    assertEquals("OpenAI API Error (500): request failed", ex.getMessage());
    verifyRequests(3);
  }

  @Test
  void openBreakerRejectsWithoutCallingTheApi() {
    stubCompletions(503, "{}");
    CircuitBreaker breaker = CircuitBreaker.builder("openai-breaker")
        .failureThreshold(2)
        .resetTimeout(Duration.ofMinutes(5))
        .build();
    try (ResilientCaller singleAttempt = newCaller(breaker, 0)) {
      OpenAiContentGenerator generator = generator("sk-test", false, singleAttempt);

      assertThrows(ExternalServiceException.class, () -> generator.generate("roofing"));
      assertThrows(ExternalServiceException.class, () -> generator.generate("roofing"));
      assertEquals(CircuitState.OPEN, breaker.state());

      assertThrows(CircuitOpenException.class, () -> generator.generate("roofing"));
      verifyRequests(2);
    }
  }

  @Test
  void fallsBackToMockWhenEnabled() throws Exception {
    stubCompletions(400, "{}");

    GeneratedContent content = generator("sk-test", true).generate("roofing");

    assertTrue(content.title().startsWith("The Ultimate Guide to roofing"), content.title());
    verifyRequests(1);
  }

  @Test
  void mockModeNeverCallsTheApi() throws Exception {
    for (String key : new String[] {null, "", "mock"}) {
      OpenAiContentGenerator generator = generator(key, false);

      assertTrue(generator.isMockMode());
      assertTrue(generator.generate("roofing").isComplete());
    }
    verifyRequests(0);
  }
}
