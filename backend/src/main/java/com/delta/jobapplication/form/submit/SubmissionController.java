package com.delta.jobapplication.form.submit;

import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.delta.jobapplication.form.sanitize.MarkupSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives one submission at a time through sanitization and the {@link SubmissionGateway}, keeping the
 * submitting flag and the last failure message for the presentation layer.
 *
 * <p>Each call to {@link #submit(JobApplicationRecord)} takes a new token. Only the settlement of the
 * most recent attempt updates the submitting/error state; a superseded attempt still completes its own
 * future but leaves the state alone.
 */
@Component
public class SubmissionController {
    private static final Logger log = LoggerFactory.getLogger(SubmissionController.class);
    public static final String FALLBACK_ERROR_MESSAGE = "An error occurred";

    private final MarkupSanitizer sanitizer;
    private final SubmissionGateway gateway;

    private long latestToken;
    private boolean submitting;
    private String submitError;

    public SubmissionController(MarkupSanitizer sanitizer, SubmissionGateway gateway) {
        this.sanitizer = sanitizer;
        this.gateway = gateway;
    }

    /**
     * @return a future holding the sanitized record on success, or failing with the gateway's original
     *     exception
     */
    public CompletableFuture<JobApplicationRecord> submit(JobApplicationRecord application) {
        long token = begin();
        JobApplicationRecord sanitized = null;
        CompletableFuture<Void> pending;
        try {
            sanitized = sanitizer.sanitizeRecord(application);
            pending = gateway.submit(sanitized);
            if (pending == null) {
                pending = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        JobApplicationRecord accepted = sanitized;
        CompletableFuture<JobApplicationRecord> result = new CompletableFuture<>();
        pending.whenComplete((ignored, error) -> {
            if (error == null) {
                settle(token, null);
                log.info("submission completed token={}", token);
                result.complete(accepted);
                return;
            }
            Throwable failure = unwrap(error);
            String message = messageOf(failure);
            settle(token, message);
            log.warn("submission failed token={} errorMessage={}", token, message, failure);
            result.completeExceptionally(failure);
        });
        return result;
    }

    public synchronized void clearError() {
        submitError = null;
    }

    public synchronized boolean isSubmitting() {
        return submitting;
    }

    public synchronized String getSubmitError() {
        return submitError;
    }

    /**
     * The user-facing text for a failure: its message, or {@value #FALLBACK_ERROR_MESSAGE} when it
     * carries none.
     */
    public static String messageOf(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause == null || cause.getMessage() == null || cause.getMessage().isBlank()) {
            return FALLBACK_ERROR_MESSAGE;
        }
        return cause.getMessage();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private synchronized long begin() {
        latestToken++;
        submitting = true;
        submitError = null;
        return latestToken;
    }

    private synchronized void settle(long token, String error) {
        if (token != latestToken) {
            log.debug("ignoring settlement of superseded submission token={} latest={}", token, latestToken);
            return;
        }
        submitting = false;
        submitError = error;
    }
}
