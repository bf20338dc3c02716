package com.delta.jobapplication.form.session;

public enum FieldPhase {
    /** Never blurred: no checks shown. */
    UNTOUCHED,
    /** Checked once on loss of focus. */
    TOUCHED,
    /** Checked on every change. */
    REVALIDATING
}
