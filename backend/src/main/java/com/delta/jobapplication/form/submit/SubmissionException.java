package com.delta.jobapplication.form.submit;

public class SubmissionException extends RuntimeException {
    public static final String SERIALIZATION = "serialization_error";
    public static final String HTTP_STATUS = "http_status";
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";

    private final String errorCode;

    public SubmissionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SubmissionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
