package jobqueue.demo;

import jobqueue.content.DistributeContentHandler;
import jobqueue.content.GenerateContentHandler;
import jobqueue.content.ai.OpenAiContentGenerator;
import jobqueue.content.draft.AuthorDirectory;
import jobqueue.spring.boot.ResilientCallerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Optional;

@Configuration
public class ContentConfiguration {

    @Bean(destroyMethod = "close")
    OpenAiContentGenerator contentGenerator(
            @Value("${demo.ai.api-key:mock}") String apiKey,
            @Value("${demo.ai.model:" + OpenAiContentGenerator.DEFAULT_MODEL + "}") String model,
            ResilientCallerFactory callers) {
        return OpenAiContentGenerator.builder()
                .apiKey(apiKey)
                .model(model)
                .resilientCaller(callers.caller("openai"))
                .build();
    }

    @Bean
    InMemoryDraftRepository draftRepository() {
        return new InMemoryDraftRepository();
    }

    @Bean
    AuthorDirectory authorDirectory(@Value("${demo.default-author-id:}") String defaultAuthorId) {
        return () -> Optional.of(defaultAuthorId).filter(id -> !id.isBlank());
    }

    @Bean
    LoggingContentDistributor contentDistributor(
            @Value("${demo.default-channels:twitter,linkedin}") List<String> defaultChannels) {
        return new LoggingContentDistributor(defaultChannels);
    }

    @Bean
    GenerateContentJob generateContentJob(OpenAiContentGenerator generator,
            InMemoryDraftRepository drafts, AuthorDirectory authors) {
        return new GenerateContentJob(new GenerateContentHandler(generator, drafts, authors));
    }

    @Bean
    DistributeContentJob distributeContentJob(LoggingContentDistributor distributor) {
        return new DistributeContentJob(new DistributeContentHandler(distributor));
    }
}
