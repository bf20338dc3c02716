package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.Optional;

public record RequiredTextRule(ApplicationField field, String message) implements FieldRule {

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        String value = field.readText(candidate);
        if (value == null || value.isBlank()) {
            return Optional.of(message);
        }
        return Optional.empty();
    }
}
