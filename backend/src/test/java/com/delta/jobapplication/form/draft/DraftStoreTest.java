package com.delta.jobapplication.form.draft;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DraftStoreTest {
    private static final String KEY = "job-application-draft";

    private InMemoryDraftStorage storage;
    private DraftStore draftStore;

    @BeforeEach
    void setUp() {
        storage = new InMemoryDraftStorage(64 * 1024);
        draftStore = new DraftStore(storage, new ObjectMapper(), KEY);
    }

    @Test
    void savedDraftSurvivesReload() {
        JobApplicationRecord record = new JobApplicationRecord(
            "Bob", "Acme", null, "", "£50k", "2024-01-01", "https://x.com/job",
            null, "", "Applied", null, "", "+44 7123", true
        );
        draftStore.save(record);

        DraftStore reloaded = new DraftStore(storage, new ObjectMapper(), KEY);

        assertThat(reloaded.load()).contains(record);
    }

    @Test
    void draftIsStoredAsJsonUnderFixedKey() {
        draftStore.save(JobApplicationRecord.defaults().with(ApplicationField.ROLE_TITLE, "Bob"));

        assertThat(storage.read(KEY)).hasValueSatisfying(json -> {
            assertThat(json).contains("\"roleTitle\":\"Bob\"");
            assertThat(json).contains("\"isLinkedInConnection\":false");
        });
    }

    @Test
    void missingOrEmptyDraftLoadsNothing() {
        assertThat(draftStore.load()).isEmpty();

        storage.write(KEY, "");
        assertThat(draftStore.load()).isEmpty();
        assertThat(storage.read(KEY)).contains("");
    }

    @Test
    void corruptedDraftIsDiscarded() {
        storage.write(KEY, "invalid-json");

        assertThat(draftStore.load()).isEmpty();
        assertThat(storage.read(KEY)).isEmpty();

        draftStore.save(JobApplicationRecord.defaults());
        assertThat(draftStore.load()).contains(JobApplicationRecord.defaults());
    }

    @Test
    void draftFileWithInvalidUtf8IsDiscarded(@TempDir Path directory) throws Exception {
        FileDraftStorage fileStorage = new FileDraftStorage(directory, 64 * 1024);
        Path file = fileStorage.fileFor(KEY);
        Files.write(file, new byte[] {'{', (byte) 0xC3, (byte) 0x28, '}'});
        DraftStore store = new DraftStore(fileStorage, new ObjectMapper(), KEY);

        assertThat(store.load()).isEmpty();
        assertThat(file).doesNotExist();

        store.save(JobApplicationRecord.defaults().with(ApplicationField.ROLE_TITLE, "Bob"));
        assertThat(store.load()).hasValueSatisfying(d -> assertThat(d.roleTitle()).isEqualTo("Bob"));
    }

    @Test
    void draftMissingFieldsLoadsWithDefaults() {
        storage.write(KEY, "{\"roleTitle\":\"Engineer\",\"unknownField\":1}");

        Optional<JobApplicationRecord> loaded = draftStore.load();

        assertThat(loaded).isPresent();
        assertThat(loaded.get().roleTitle()).isEqualTo("Engineer");
        assertThat(loaded.get().companyName()).isNull();
        assertThat(loaded.get().isLinkedInConnection()).isFalse();
    }

    @Test
    void clearRemovesDraft() {
        draftStore.save(JobApplicationRecord.defaults());

        draftStore.clear();

        assertThat(storage.read(KEY)).isEmpty();
        assertThat(draftStore.load()).isEmpty();
    }

    @Test
    void quotaOverflowIsAbsorbed() {
        DraftStore tiny = new DraftStore(new InMemoryDraftStorage(10), new ObjectMapper(), KEY);

        assertThatCode(() -> tiny.save(JobApplicationRecord.defaults())).doesNotThrowAnyException();
        assertThat(tiny.load()).isEmpty();
    }

    @Test
    void storageFailuresNeverEscape() {
        DraftStorage broken = mock(DraftStorage.class);
        when(broken.read(anyString())).thenThrow(new DraftStorageException("storage unavailable"));
        doThrow(new DraftStorageException("disk full")).when(broken).write(anyString(), anyString());
        doThrow(new IllegalStateException("api disabled")).when(broken).remove(anyString());
        DraftStore store = new DraftStore(broken, new ObjectMapper(), KEY);

        assertThatCode(() -> {
            assertThat(store.load()).isEmpty();
            store.save(JobApplicationRecord.defaults());
            store.clear();
        }).doesNotThrowAnyException();
        verify(broken).remove(KEY);
    }

    @Test
    void corruptedDraftIsStillReportedAbsentWhenRemovalFails() {
        DraftStorage broken = mock(DraftStorage.class);
        when(broken.read(KEY)).thenReturn(Optional.of("{not json"));
        doThrow(new DraftStorageException("read only")).when(broken).remove(KEY);
        DraftStore store = new DraftStore(broken, new ObjectMapper(), KEY);

        assertThat(store.load()).isEmpty();
        verify(broken).remove(KEY);
    }
}
