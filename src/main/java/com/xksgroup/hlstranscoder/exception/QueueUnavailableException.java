package com.xksgroup.hlstranscoder.exception;

public class QueueUnavailableException extends TranscodeException {

    public QueueUnavailableException(String message, Throwable cause) {
        super("QUEUE_UNAVAILABLE", message, cause);
    }
}
