package com.delta.jobapplication.form.session;

import com.delta.jobapplication.form.draft.DraftStore;
import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.delta.jobapplication.form.model.ValidationIssue;
import com.delta.jobapplication.form.model.ValidationResult;
import com.delta.jobapplication.form.submit.SubmissionController;
import com.delta.jobapplication.form.validation.RecordValidator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Orchestrates one application form: applies edits, decides when each field is validated, autosaves
 * the draft after every edit once the form is dirty, and hands valid records to the
 * {@link SubmissionController}.
 *
 * <p>The draft slot is process-wide, so one active session per process is assumed.
 */
@Service
public class FormSession {
    private static final Logger log = LoggerFactory.getLogger(FormSession.class);

    private final RecordValidator validator;
    private final DraftStore draftStore;
    private final SubmissionController submissionController;
    private final Map<ApplicationField, FieldValidationState> fieldStates = new EnumMap<>(ApplicationField.class);

    private JobApplicationRecord current = JobApplicationRecord.defaults();
    private boolean dirty;
    // cleared only after the reset or the failure is applied, unlike the controller's flag
    private boolean submissionInFlight;

    public FormSession(RecordValidator validator, DraftStore draftStore, SubmissionController submissionController) {
        this.validator = validator;
        this.draftStore = draftStore;
        this.submissionController = submissionController;
        resetFieldStates();
    }

    /**
     * Restores the saved draft, if any. The restored values are not validated until the next edit,
     * blur or submit.
     */
    @PostConstruct
    public synchronized void start() {
        draftStore.load().ifPresent(draft -> {
            current = draft;
            log.info("restored application draft key={}", draftStore.getKey());
        });
    }

    public synchronized FieldView edit(ApplicationField field, Object value) {
        current = current.with(field, value);
        dirty = true;
        FieldValidationState state = fieldStates.get(field);
        if (state.onChange()) {
            revalidate(field, state);
        }
        draftStore.save(current);
        return view(field);
    }

    public synchronized FieldView blur(ApplicationField field) {
        FieldValidationState state = fieldStates.get(field);
        if (state.onBlur()) {
            revalidate(field, state);
        }
        return view(field);
    }

    /**
     * Validates the whole record and, when it is valid, submits it. A call made while a previous
     * submission is still in flight is ignored and reports {@link SubmitOutcome.Status#IN_PROGRESS}.
     *
     * @return a future that fails with the gateway's original exception when the submission fails
     */
    public CompletableFuture<SubmitOutcome> submit() {
        CompletableFuture<JobApplicationRecord> pending;
        synchronized (this) {
            if (submissionInFlight) {
                log.info("submit ignored: a submission is already in flight");
                return CompletableFuture.completedFuture(SubmitOutcome.inProgress());
            }
            ValidationResult result = validator.validate(current);
            for (ApplicationField field : ApplicationField.values()) {
                FieldValidationState state = fieldStates.get(field);
                state.onSubmitAttempt();
                ValidationIssue issue = result.issueAt(field.jsonName());
                state.recordResult(issue == null ? null : issue.message());
            }
            if (!result.ok()) {
                log.info("submit blocked by validation issues={}", result.issues().size());
                return CompletableFuture.completedFuture(SubmitOutcome.invalid(result.issues()));
            }
            submissionInFlight = true;
            pending = submissionController.submit(result.value());
        }

        CompletableFuture<SubmitOutcome> outcome = new CompletableFuture<>();
        pending.whenComplete((submitted, error) -> {
            if (error != null) {
                onSubmitFailed();
                outcome.completeExceptionally(error);
                return;
            }
            onSubmitted();
            outcome.complete(SubmitOutcome.submitted(submitted));
        });
        return outcome;
    }

    public void clearSubmitError() {
        submissionController.clearError();
    }

    public synchronized JobApplicationRecord current() {
        return current;
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized FieldPhase phaseOf(ApplicationField field) {
        return fieldStates.get(field).getPhase();
    }

    public synchronized FieldView fieldView(ApplicationField field) {
        return view(field);
    }

    public synchronized FormSnapshot snapshot() {
        Map<String, FieldView> fields = new LinkedHashMap<>();
        for (ApplicationField field : ApplicationField.values()) {
            fields.put(field.jsonName(), view(field));
        }
        return new FormSnapshot(
            current,
            fields,
            dirty,
            submissionInFlight || submissionController.isSubmitting(),
            submissionController.getSubmitError()
        );
    }

    private synchronized void onSubmitted() {
        draftStore.clear();
        current = JobApplicationRecord.defaults();
        dirty = false;
        resetFieldStates();
        submissionInFlight = false;
        log.info("application submitted, draft cleared and form reset");
    }

    private synchronized void onSubmitFailed() {
        submissionInFlight = false;
    }

    private void revalidate(ApplicationField field, FieldValidationState state) {
        state.recordResult(validator.validateField(current, field).map(ValidationIssue::message).orElse(null));
    }

    private FieldView view(ApplicationField field) {
        FieldValidationState state = fieldStates.get(field);
        return new FieldView(
            field.jsonName(),
            field.read(current),
            state.getErrorMessage(),
            state.isTouched(),
            state.isInvalid(),
            state.isDirty()
        );
    }

    private void resetFieldStates() {
        for (ApplicationField field : ApplicationField.values()) {
            fieldStates.put(field, new FieldValidationState());
        }
    }
}
