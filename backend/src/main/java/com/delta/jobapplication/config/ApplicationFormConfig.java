package com.delta.jobapplication.config;

import com.delta.jobapplication.form.draft.DraftStorage;
import com.delta.jobapplication.form.draft.FileDraftStorage;
import com.delta.jobapplication.form.draft.InMemoryDraftStorage;
import com.delta.jobapplication.form.submit.HttpSubmissionGateway;
import com.delta.jobapplication.form.submit.LoggingSubmissionGateway;
import com.delta.jobapplication.form.submit.SubmissionGateway;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ApplicationFormConfig {
    private static final Logger log = LoggerFactory.getLogger(ApplicationFormConfig.class);

    @Bean(name = "submissionExecutor", destroyMethod = "shutdown")
    public ExecutorService submissionExecutor(ApplicationFormProperties properties) {
        return Executors.newFixedThreadPool(properties.getSubmission().getExecutorThreads(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("form-submission");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public DraftStorage draftStorage(ApplicationFormProperties properties) {
        ApplicationFormProperties.Draft draft = properties.getDraft();
        if (draft.getStorage() == ApplicationFormProperties.StorageType.MEMORY) {
            log.info("draft storage=memory maxBytes={}", draft.getMaxBytes());
            return new InMemoryDraftStorage(draft.getMaxBytes());
        }
        Path directory = Path.of(draft.getDirectory()).toAbsolutePath().normalize();
        log.info("draft storage=file directory={} maxBytes={}", directory, draft.getMaxBytes());
        return new FileDraftStorage(directory, draft.getMaxBytes());
    }

    @Bean
    public SubmissionGateway submissionGateway(
        ApplicationFormProperties properties,
        @Qualifier("submissionExecutor") ExecutorService submissionExecutor,
        ObjectMapper objectMapper
    ) {
        if (properties.getSubmission().hasEndpoint()) {
            log.info("submission gateway=http endpoint={}", properties.getSubmission().getEndpoint());
            return new HttpSubmissionGateway(properties, submissionExecutor, objectMapper);
        }
        log.info("submission gateway=logging (no endpoint configured)");
        return new LoggingSubmissionGateway(submissionExecutor, objectMapper);
    }
}
