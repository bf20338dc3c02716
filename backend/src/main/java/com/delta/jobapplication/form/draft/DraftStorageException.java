package com.delta.jobapplication.form.draft;

public class DraftStorageException extends RuntimeException {
    public DraftStorageException(String message) {
        super(message);
    }

    public DraftStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
