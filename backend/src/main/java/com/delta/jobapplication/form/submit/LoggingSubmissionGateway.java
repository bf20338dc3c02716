package com.delta.jobapplication.form.submit;

import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Stand-in used when no submission endpoint is configured: logs the payload it would have sent.
 */
public class LoggingSubmissionGateway implements SubmissionGateway {
    private static final Logger log = LoggerFactory.getLogger(LoggingSubmissionGateway.class);

    private final Executor executor;
    private final ObjectMapper objectMapper;

    public LoggingSubmissionGateway(Executor executor, ObjectMapper objectMapper) {
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<Void> submit(JobApplicationRecord application) {
        return CompletableFuture.runAsync(() -> log.info("application submitted payload={}", toJson(application)), executor);
    }

    private String toJson(JobApplicationRecord application) {
        try {
            return objectMapper.writeValueAsString(application);
        } catch (JsonProcessingException e) {
            throw new SubmissionException(SubmissionException.SERIALIZATION, "Failed to serialize application", e);
        }
    }
}
