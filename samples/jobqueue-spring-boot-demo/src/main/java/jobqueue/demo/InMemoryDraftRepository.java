package jobqueue.demo;

import jobqueue.content.draft.Draft;
import jobqueue.content.draft.DraftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class InMemoryDraftRepository implements DraftRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDraftRepository.class);

    private final Map<String, Draft> drafts = new LinkedHashMap<>();

    @Override
    public synchronized String save(Draft draft) {
        String id = UUID.randomUUID().toString();
        drafts.put(id, draft);
        log.info("[Drafts] saved {} as {}", draft.slug(), id);
        return id;
    }

    public synchronized Map<String, Draft> all() {
        return new LinkedHashMap<>(drafts);
    }
}
