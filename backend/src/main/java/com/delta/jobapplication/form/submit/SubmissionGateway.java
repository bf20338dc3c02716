package com.delta.jobapplication.form.submit;

import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.concurrent.CompletableFuture;

/**
 * The boundary that durably stores a submitted application. Receives records that have already been
 * validated and sanitized.
 */
public interface SubmissionGateway {

    CompletableFuture<Void> submit(JobApplicationRecord application);
}
