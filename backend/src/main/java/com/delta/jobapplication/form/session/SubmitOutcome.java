package com.delta.jobapplication.form.session;

import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.delta.jobapplication.form.model.ValidationIssue;

import java.util.List;

public record SubmitOutcome(
    Status status,
    JobApplicationRecord submitted,
    List<ValidationIssue> issues
) {
    public enum Status {
        SUBMITTED,
        INVALID,
        IN_PROGRESS
    }

    public static SubmitOutcome submitted(JobApplicationRecord submitted) {
        return new SubmitOutcome(Status.SUBMITTED, submitted, List.of());
    }

    public static SubmitOutcome invalid(List<ValidationIssue> issues) {
        return new SubmitOutcome(Status.INVALID, null, List.copyOf(issues));
    }

    public static SubmitOutcome inProgress() {
        return new SubmitOutcome(Status.IN_PROGRESS, null, List.of());
    }
}
