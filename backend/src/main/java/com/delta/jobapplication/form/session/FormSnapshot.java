package com.delta.jobapplication.form.session;

import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.util.Map;

public record FormSnapshot(
    JobApplicationRecord values,
    Map<String, FieldView> fields,
    boolean dirty,
    boolean submitting,
    String submitError
) {
}
