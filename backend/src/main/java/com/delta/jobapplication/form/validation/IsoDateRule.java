package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Empty values pass; pair with {@link RequiredTextRule} for mandatory dates.
 */
public record IsoDateRule(ApplicationField field, String message) implements FieldRule {

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        String value = field.readText(candidate);
        if (FieldRule.isEmpty(value)) {
            return Optional.empty();
        }
        return parse(value) == null ? Optional.of(message) : Optional.empty();
    }

    static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
