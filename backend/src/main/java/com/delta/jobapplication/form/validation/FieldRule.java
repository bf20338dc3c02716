package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.Optional;

/**
 * One declarative check attached to a single field path. Implementations are stateless and may read
 * other fields of the candidate (cross-field rules) but report only against {@link #field()}.
 */
public interface FieldRule {

    ApplicationField field();

    /**
     * @return the failure message, or empty when the candidate satisfies the rule
     */
    Optional<String> check(JobApplicationRecord candidate);

    static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
