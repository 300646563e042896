package jobqueue.demo;

import jobqueue.JobHandler;
import jobqueue.content.DistributeContentHandler;
import jobqueue.spring.boot.JobHandlerFor;

import java.util.Map;

@JobHandlerFor("DISTRIBUTE_CONTENT")
public class DistributeContentJob implements JobHandler {

    private final DistributeContentHandler delegate;

    public DistributeContentJob(DistributeContentHandler delegate) {
        this.delegate = delegate;
    }

    @Override
    public Object handle(Map<String, Object> payload) throws Exception {
        return delegate.handle(payload);
    }
}
