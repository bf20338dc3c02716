package com.delta.jobapplication.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "application-form")
public class ApplicationFormProperties {
    private Draft draft = new Draft();
    private Submission submission = new Submission();

    public Draft getDraft() {
        return draft;
    }

    public void setDraft(Draft draft) {
        this.draft = draft;
    }

    public Submission getSubmission() {
        return submission;
    }

    public void setSubmission(Submission submission) {
        this.submission = submission;
    }

    public enum StorageType {
        FILE,
        MEMORY
    }

    public static class Draft {
        public static final String DEFAULT_KEY = "job-application-draft";
        private static final long DEFAULT_MAX_BYTES = 5L * 1024 * 1024;

        private StorageType storage = StorageType.FILE;
        private String directory = "./data/drafts";
        private String key = DEFAULT_KEY;
        private long maxBytes = DEFAULT_MAX_BYTES;

        public StorageType getStorage() {
            return storage == null ? StorageType.FILE : storage;
        }

        public void setStorage(StorageType storage) {
            this.storage = storage;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getKey() {
            return normalizeKey(key);
        }

        public void setKey(String key) {
            this.key = normalizeKey(key);
        }

        public long getMaxBytes() {
            return Math.max(1, maxBytes);
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = Math.max(1, maxBytes);
        }

        public static String normalizeKey(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return DEFAULT_KEY;
            }
            return candidate.trim();
        }
    }

    public static class Submission {
        private String endpoint = "";
        private int timeoutSeconds = 20;
        private int executorThreads = 2;

        public String getEndpoint() {
            return endpoint == null ? "" : endpoint.trim();
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean hasEndpoint() {
            return !getEndpoint().isEmpty();
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getExecutorThreads() {
            return Math.max(1, executorThreads);
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = Math.max(1, executorThreads);
        }
    }
}
