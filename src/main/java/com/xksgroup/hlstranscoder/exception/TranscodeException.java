package com.xksgroup.hlstranscoder.exception;

import lombok.Getter;

/**
 * Base of the transcode error taxonomy. The code is what the HTTP layer and the
 * rendition error column expose to clients.
 */
@Getter
public abstract class TranscodeException extends RuntimeException {

    private final String code;

    protected TranscodeException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected TranscodeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
