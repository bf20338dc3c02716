package com.delta.jobapplication.form.model;

public record ValidationIssue(
    String path,
    String message
) {
}
