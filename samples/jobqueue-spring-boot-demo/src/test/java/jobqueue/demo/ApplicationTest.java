package jobqueue.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:jobqueue_demo_test;DB_CLOSE_DELAY=-1",
    "jobqueue.worker.interval-ms=50",
    "demo.ai.api-key=mock"
})
@AutoConfigureMockMvc
class ApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void generateJobCompletesInMockMode() throws Exception {
        String jobId = enqueue("/jobs/generate", "{\"topic\":\"roofing\"}");

        JsonNode job = awaitTerminal(jobId);

        assertEquals("COMPLETED", job.path("status").asText(), job.toString());
        assertTrue(job.path("result").path("title").asText().contains("roofing"));
        assertFalse(job.path("result").path("draftId").asText().isEmpty());
    }

    @Test
    void distributeJobToleratesFailingChannel() throws Exception {
        String jobId = enqueue("/jobs/distribute", "{\"contentId\":\"p1\",\"channels\":[\"fail\",\"twitter\"]}");

        JsonNode job = awaitTerminal(jobId);

        assertEquals("COMPLETED", job.path("status").asText(), job.toString());
        assertEquals("fail", job.path("result").path("failedChannels").path(0).asText());
    }

    @Test
    void unknownTypeFailsAndCanBeRetried() throws Exception {
        String jobId = enqueue("/jobs/FOO", "{}");

        JsonNode job = awaitTerminal(jobId);
        assertEquals("FAILED", job.path("status").asText());
        assertTrue(job.path("error").asText().contains("FOO"));

        mvc.perform(post("/jobs/" + jobId + "/retry")).andExpect(status().isOk());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mvc.perform(get("/jobs/does-not-exist")).andExpect(status().isNotFound());
    }

    private String enqueue(String path, String body) throws Exception {
        String response = mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("jobId").asText();
    }

    private JsonNode awaitTerminal(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        JsonNode job;
        do {
            String response = mvc.perform(get("/jobs/" + jobId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            job = objectMapper.readTree(response);
            String state = job.path("status").asText();
            if (state.equals("COMPLETED") || state.equals("FAILED")) {
                return job;
            }
            Thread.sleep(50);
        } while (System.currentTimeMillis() < deadline);
        return job;
    }
}
