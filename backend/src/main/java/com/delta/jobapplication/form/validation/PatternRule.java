package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Optional text that must fully match {@code pattern} when non-empty.
 */
public record PatternRule(ApplicationField field, Pattern pattern, String message) implements FieldRule {

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        String value = field.readText(candidate);
        if (FieldRule.isEmpty(value)) {
            return Optional.empty();
        }
        return pattern.matcher(value).matches() ? Optional.empty() : Optional.of(message);
    }
}
