package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Cross-field rule: {@code field} must not be earlier than {@code reference}. Equal dates pass. Only
 * applies when both values are present and parse as ISO dates.
 */
public record DateNotBeforeRule(ApplicationField field, ApplicationField reference, String message)
    implements FieldRule {

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        LocalDate later = IsoDateRule.parse(field.readText(candidate));
        LocalDate earlier = IsoDateRule.parse(reference.readText(candidate));
        if (later == null || earlier == null) {
            return Optional.empty();
        }
        return later.isBefore(earlier) ? Optional.of(message) : Optional.empty();
    }
}
