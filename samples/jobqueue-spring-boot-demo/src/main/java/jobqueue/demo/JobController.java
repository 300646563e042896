package jobqueue.demo;

import jobqueue.JobClient;
import jobqueue.admin.JobAdmin;
import jobqueue.content.ContentJobType;
import jobqueue.content.draft.Draft;
import jobqueue.model.Job;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class JobController {

    private final JobClient jobClient;
    private final JobAdmin jobAdmin;
    private final InMemoryDraftRepository drafts;

    public JobController(JobClient jobClient, JobAdmin jobAdmin, InMemoryDraftRepository drafts) {
        this.jobClient = jobClient;
        this.jobAdmin = jobAdmin;
        this.drafts = drafts;
    }

    @PostMapping("/jobs/generate")
    public Map<String, String> generate(@RequestBody Map<String, Object> payload) {
        return Map.of("jobId", jobClient.enqueue(ContentJobType.GENERATE_CONTENT, payload));
    }

    @PostMapping("/jobs/distribute")
    public Map<String, String> distribute(@RequestBody Map<String, Object> payload) {
        return Map.of("jobId", jobClient.enqueue(ContentJobType.DISTRIBUTE_CONTENT, payload));
    }

    @PostMapping("/jobs/{type}")
    public Map<String, String> enqueue(@PathVariable String type,
            @RequestBody(required = false) Map<String, Object> payload) {
        return Map.of("jobId", jobClient.enqueue(type, payload == null ? Map.of() : payload));
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        return jobClient.get(id)
                .map(job -> ResponseEntity.ok(view(job)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/jobs/failed")
    public List<Map<String, Object>> failed(@RequestParam(defaultValue = "20") int limit) {
        return jobAdmin.queryFailed(limit).stream().map(this::view).toList();
    }

    @PostMapping("/jobs/{id}/retry")
    public ResponseEntity<Map<String, String>> retry(@PathVariable String id) {
        return jobAdmin.reEnqueue(id)
                .map(newId -> ResponseEntity.ok(Map.of("jobId", newId)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "job " + id + " is not FAILED")));
    }

    @GetMapping("/drafts")
    public Map<String, Draft> drafts() {
        return drafts.all();
    }

    private Map<String, Object> view(Job job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.id());
        view.put("type", job.type());
        view.put("status", job.status().name());
        view.put("attempts", job.attempts());
        view.put("payload", jobClient.payloadOf(job));
        view.put("result", job.resultJson() == null ? null : jobClient.resultOf(job));
        view.put("error", job.error());
        view.put("createdAt", job.createdAt());
        view.put("lockedAt", job.lockedAt());
        view.put("processedAt", job.processedAt());
        return view;
    }
}
