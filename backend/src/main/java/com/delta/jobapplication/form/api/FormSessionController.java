package com.delta.jobapplication.form.api;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.session.FieldView;
import com.delta.jobapplication.form.session.FormSession;
import com.delta.jobapplication.form.session.FormSnapshot;
import com.delta.jobapplication.form.session.SubmitOutcome;
import com.delta.jobapplication.form.submit.SubmissionController;
import com.delta.jobapplication.form.submit.SubmissionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/api/application-form")
public class FormSessionController {
    private final FormSession formSession;

    public FormSessionController(FormSession formSession) {
        this.formSession = formSession;
    }

    @GetMapping
    public FormSnapshot snapshot() {
        return formSession.snapshot();
    }

    @PutMapping("/fields/{field}")
    public FieldView edit(@PathVariable("field") String field, @RequestBody(required = false) FieldEditRequest request) {
        Object value = request == null ? null : request.value();
        return formSession.edit(ApplicationField.requireByJsonName(field), value);
    }

    @PostMapping("/fields/{field}/blur")
    public FieldView blur(@PathVariable("field") String field) {
        return formSession.blur(ApplicationField.requireByJsonName(field));
    }

    @PostMapping("/submit")
    public CompletableFuture<ResponseEntity<Object>> submit() {
        return formSession.submit().handle(this::toResponse);
    }

    @DeleteMapping("/submit-error")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearSubmitError() {
        formSession.clearSubmitError();
    }

    private ResponseEntity<Object> toResponse(SubmitOutcome outcome, Throwable error) {
        if (error != null) {
            Throwable failure = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "submission_failed");
            body.put("code", failure instanceof SubmissionException se ? se.getErrorCode() : null);
            body.put("message", SubmissionController.messageOf(failure));
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
        return switch (outcome.status()) {
            case SUBMITTED -> ResponseEntity.ok(outcome.submitted());
            case INVALID -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", "validation_failed", "issues", outcome.issues()));
            case IN_PROGRESS -> ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "submission_in_progress", "message", "A submission is already in progress"));
        };
    }
}
