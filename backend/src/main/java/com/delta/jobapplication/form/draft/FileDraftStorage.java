package com.delta.jobapplication.form.draft;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each key as {@code <key>.json} (UTF-8) under one directory. Writes go to a temp file that is
 * then moved over the target so a crash mid-write never leaves a truncated draft.
 */
public class FileDraftStorage implements DraftStorage {
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final long maxBytes;

    public FileDraftStorage(Path directory, long maxBytes) {
        this.directory = directory;
        this.maxBytes = Math.max(1, maxBytes);
    }

    @Override
    public Optional<String> read(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            throw new CorruptDraftException("Draft file is not valid UTF-8: " + file, e);
        } catch (IOException e) {
            throw new DraftStorageException("Failed to read draft file " + file, e);
        }
    }

    @Override
    public void write(String key, String value) {
        Path file = fileFor(key);
        byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxBytes) {
            throw new StorageQuotaExceededException(key, bytes.length, maxBytes);
        }
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key, ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DraftStorageException("Failed to write draft file " + file, e);
        }
    }

    @Override
    public void remove(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new DraftStorageException("Failed to delete draft file " + file, e);
        }
    }

    public Path fileFor(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new DraftStorageException("Unsupported draft key: " + key);
        }
        return directory.resolve(key + ".json");
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ignored) {
            // the original write failure is the one reported
        }
    }
}
