package com.xksgroup.hlstranscoder.exception;

public class StorageUnavailableException extends TranscodeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super("STORAGE_UNAVAILABLE", message, cause);
    }
}
