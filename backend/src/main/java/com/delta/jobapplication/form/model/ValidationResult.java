package com.delta.jobapplication.form.model;

import java.util.List;

public record ValidationResult(
    boolean ok,
    JobApplicationRecord value,
    List<ValidationIssue> issues
) {
    public static ValidationResult valid(JobApplicationRecord value) {
        return new ValidationResult(true, value, List.of());
    }

    public static ValidationResult invalid(List<ValidationIssue> issues) {
        return new ValidationResult(false, null, List.copyOf(issues));
    }

    public ValidationIssue issueAt(String path) {
        for (ValidationIssue issue : issues) {
            if (issue.path().equals(path)) {
                return issue;
            }
        }
        return null;
    }
}
