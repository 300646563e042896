package jobqueue.demo;

import jobqueue.JobHandler;
import jobqueue.content.GenerateContentHandler;
import jobqueue.spring.boot.JobHandlerFor;

import java.util.Map;

@JobHandlerFor("GENERATE_CONTENT")
public class GenerateContentJob implements JobHandler {

    private final GenerateContentHandler delegate;

    public GenerateContentJob(GenerateContentHandler delegate) {
        this.delegate = delegate;
    }

    @Override
    public Object handle(Map<String, Object> payload) throws Exception {
        return delegate.handle(payload);
    }
}
