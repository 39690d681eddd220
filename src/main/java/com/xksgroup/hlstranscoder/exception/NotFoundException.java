package com.xksgroup.hlstranscoder.exception;

public class NotFoundException extends TranscodeException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public NotFoundException(String message, Throwable cause) {
        super("NOT_FOUND", message, cause);
    }

    public static NotFoundException video(String videoId) {
        return new NotFoundException("video not found: " + videoId);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("job not found: " + jobId);
    }

    public static NotFoundException key(String key) {
        return new NotFoundException("object not found: " + key);
    }
}
