package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.delta.jobapplication.form.model.ValidationIssue;
import com.delta.jobapplication.form.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a list of {@link FieldRule}s over a candidate record. Each path reports at most one issue:
 * the first rule declared for that field that fails.
 */
@Component
public class RecordValidator {
    private final List<FieldRule> rules;

    public RecordValidator() {
        this(JobApplicationRules.rules());
    }

    public RecordValidator(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ValidationResult validate(JobApplicationRecord candidate) {
        JobApplicationRecord subject = candidate == null ? JobApplicationRecord.defaults() : candidate;
        Map<ApplicationField, ValidationIssue> failed = new EnumMap<>(ApplicationField.class);
        List<ValidationIssue> issues = new ArrayList<>();
        for (FieldRule rule : rules) {
            if (failed.containsKey(rule.field())) {
                continue;
            }
            Optional<String> message = rule.check(subject);
            if (message.isPresent()) {
                ValidationIssue issue = new ValidationIssue(rule.field().jsonName(), message.get());
                failed.put(rule.field(), issue);
                issues.add(issue);
            }
        }
        if (issues.isEmpty()) {
            return ValidationResult.valid(subject);
        }
        return ValidationResult.invalid(issues);
    }

    public Optional<ValidationIssue> validateField(JobApplicationRecord candidate, ApplicationField field) {
        JobApplicationRecord subject = candidate == null ? JobApplicationRecord.defaults() : candidate;
        for (FieldRule rule : rules) {
            if (rule.field() != field) {
                continue;
            }
            Optional<String> message = rule.check(subject);
            if (message.isPresent()) {
                return Optional.of(new ValidationIssue(field.jsonName(), message.get()));
            }
        }
        return Optional.empty();
    }
}
