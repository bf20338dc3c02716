package com.delta.jobapplication.form.draft;

import com.delta.jobapplication.config.ApplicationFormProperties;
import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Single-slot draft persistence. Every storage or serialization failure is logged and absorbed here
 * so that a broken store degrades the session to in-memory editing instead of failing an edit.
 */
@Component
public class DraftStore {
    private static final Logger log = LoggerFactory.getLogger(DraftStore.class);

    private final DraftStorage storage;
    private final ObjectMapper objectMapper;
    private final String key;

    @Autowired
    public DraftStore(DraftStorage storage, ObjectMapper objectMapper, ApplicationFormProperties properties) {
        this(storage, objectMapper, properties.getDraft().getKey());
    }

    public DraftStore(DraftStorage storage, ObjectMapper objectMapper, String key) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.key = ApplicationFormProperties.Draft.normalizeKey(key);
    }

    public String getKey() {
        return key;
    }

    public Optional<JobApplicationRecord> load() {
        String payload;
        try {
            payload = storage.read(key).orElse(null);
        } catch (CorruptDraftException e) {
            log.warn("failed to decode saved draft key={} decision=discard error={}", key, e.getMessage());
            discardCorrupted();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("draft storage unavailable key={} operation=load", key, e);
            return Optional.empty();
        }
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, JobApplicationRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("failed to load saved draft key={} decision=discard error={}", key, e.getOriginalMessage());
            discardCorrupted();
            return Optional.empty();
        }
    }

    public void save(JobApplicationRecord draft) {
        try {
            String payload = objectMapper.writeValueAsString(draft);
            storage.write(key, payload);
            log.debug("draft saved key={} bytes={}", key, payload.length());
        } catch (JsonProcessingException e) {
            log.warn("failed to serialize draft key={}", key, e);
        } catch (Exception e) {
            log.warn("failed to save draft key={}", key, e);
        }
    }

    public void clear() {
        try {
            storage.remove(key);
        } catch (Exception e) {
            log.warn("failed to clear draft key={}", key, e);
        }
    }

    private void discardCorrupted() {
        try {
            storage.remove(key);
        } catch (Exception e) {
            log.warn("failed to remove corrupted draft key={}", key, e);
        }
    }
}
