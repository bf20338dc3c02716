package com.delta.jobapplication.form.draft;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDraftStorage implements DraftStorage {
    private final Map<String, String> entries = new ConcurrentHashMap<>();
    private final long maxBytes;

    public InMemoryDraftStorage(long maxBytes) {
        this.maxBytes = Math.max(1, maxBytes);
    }

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(String key, String value) {
        String payload = value == null ? "" : value;
        long size = payload.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxBytes) {
            throw new StorageQuotaExceededException(key, size, maxBytes);
        }
        entries.put(key, payload);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }
}
