package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.Optional;
import java.util.regex.Pattern;

public record EmailRule(ApplicationField field, String message) implements FieldRule {

    private static final Pattern EMAIL = Pattern.compile(
        "^(?!\\.)(?!.*\\.\\.)([A-Z0-9_'+\\-.]*)[A-Z0-9_+\\-]@([A-Z0-9][A-Z0-9\\-]*\\.)+[A-Z]{2,}$",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        String value = field.readText(candidate);
        if (FieldRule.isEmpty(value)) {
            return Optional.empty();
        }
        return EMAIL.matcher(value).matches() ? Optional.empty() : Optional.of(message);
    }
}
