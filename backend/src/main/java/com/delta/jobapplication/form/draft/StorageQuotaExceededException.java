package com.delta.jobapplication.form.draft;

public class StorageQuotaExceededException extends DraftStorageException {
    private final long sizeBytes;
    private final long maxBytes;

    public StorageQuotaExceededException(String key, long sizeBytes, long maxBytes) {
        super("Draft for key " + key + " is " + sizeBytes + " bytes, quota is " + maxBytes);
        this.sizeBytes = sizeBytes;
        this.maxBytes = maxBytes;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
