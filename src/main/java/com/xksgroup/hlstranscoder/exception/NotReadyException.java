package com.xksgroup.hlstranscoder.exception;

public class NotReadyException extends TranscodeException {

    public NotReadyException(String message) {
        super("NOT_READY", message);
    }
}
