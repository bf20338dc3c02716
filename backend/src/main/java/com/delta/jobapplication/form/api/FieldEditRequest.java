package com.delta.jobapplication.form.api;

public record FieldEditRequest(Object value) {
}
