package com.delta.jobapplication.form.session;

/**
 * One field as the presentation layer sees it.
 *
 * @param touched the field has lost focus at least once, so its errors are shown; an edit alone does
 *     not set it
 * @param dirty the user has edited the field at least once in this session
 */
public record FieldView(
    String field,
    Object value,
    String errorMessage,
    boolean touched,
    boolean invalid,
    boolean dirty
) {
}
