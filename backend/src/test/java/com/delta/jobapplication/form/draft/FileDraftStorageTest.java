package com.delta.jobapplication.form.draft;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileDraftStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void writesUtf8JsonFilePerKey() throws Exception {
        Path directory = tempDir.resolve("drafts");
        FileDraftStorage storage = new FileDraftStorage(directory, 1024);

        storage.write("job-application-draft", "{\"salary\":\"£50k\"}");

        Path file = directory.resolve("job-application-draft.json");
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("{\"salary\":\"£50k\"}");
        assertThat(storage.read("job-application-draft")).contains("{\"salary\":\"£50k\"}");
        try (var files = Files.list(directory)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    void overwritesAndRemoves() {
        FileDraftStorage storage = new FileDraftStorage(tempDir, 1024);
        storage.write("draft", "one");
        storage.write("draft", "two");

        assertThat(storage.read("draft")).contains("two");

        storage.remove("draft");
        storage.remove("draft");
        assertThat(storage.read("draft")).isEmpty();
    }

    @Test
    void undecodableFileIsReportedAsCorrupt() throws Exception {
        FileDraftStorage storage = new FileDraftStorage(tempDir, 1024);
        Files.write(storage.fileFor("draft"), new byte[] {(byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> storage.read("draft"))
            .isInstanceOf(CorruptDraftException.class);
    }

    @Test
    void rejectsPayloadOverQuota() {
        FileDraftStorage storage = new FileDraftStorage(tempDir, 4);

        assertThatThrownBy(() -> storage.write("draft", "12345"))
            .isInstanceOf(StorageQuotaExceededException.class);
        assertThat(storage.read("draft")).isEmpty();
    }

    @Test
    void rejectsKeysThatEscapeDirectory() {
        FileDraftStorage storage = new FileDraftStorage(tempDir, 1024);

        assertThatThrownBy(() -> storage.write("../outside", "x"))
            .isInstanceOf(DraftStorageException.class);
    }
}
