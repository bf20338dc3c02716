package com.delta.jobapplication.form.draft;

import java.util.Optional;

/**
 * Key-value text store backing drafts. Implementations signal failures with
 * {@link DraftStorageException}.
 */
public interface DraftStorage {

    Optional<String> read(String key);

    void write(String key, String value);

    void remove(String key);
}
