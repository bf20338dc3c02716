package com.delta.jobapplication.form.draft;

/**
 * The stored bytes for a key cannot be decoded as a draft, so the entry should be discarded.
 */
public class CorruptDraftException extends DraftStorageException {
    public CorruptDraftException(String message, Throwable cause) {
        super(message, cause);
    }
}
