package com.delta.jobapplication.form.session;

/**
 * Per-field validation timing: a field is not checked while the user is still typing into it for the
 * first time, is checked when it first loses focus, and from then on is checked on every change. A
 * submit attempt moves every field straight to {@link FieldPhase#REVALIDATING}.
 */
public class FieldValidationState {
    private FieldPhase phase = FieldPhase.UNTOUCHED;
    private boolean dirty;
    private String errorMessage;

    /**
     * @return whether the field should be checked now
     */
    public boolean onBlur() {
        if (phase == FieldPhase.UNTOUCHED) {
            phase = FieldPhase.TOUCHED;
        }
        return true;
    }

    /**
     * Records an edit.
     *
     * @return whether the field should be checked now
     */
    public boolean onChange() {
        dirty = true;
        return switch (phase) {
            case UNTOUCHED -> false;
            case TOUCHED -> {
                phase = FieldPhase.REVALIDATING;
                yield true;
            }
            case REVALIDATING -> true;
        };
    }

    public void onSubmitAttempt() {
        phase = FieldPhase.REVALIDATING;
    }

    public void recordResult(String message) {
        this.errorMessage = message;
    }

    public FieldPhase getPhase() {
        return phase;
    }

    public boolean isDirty() {
        return dirty;
    }

    public boolean isTouched() {
        return phase != FieldPhase.UNTOUCHED;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isInvalid() {
        return errorMessage != null;
    }
}
