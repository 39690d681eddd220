package com.xksgroup.hlstranscoder.exception;

import lombok.Getter;

/**
 * Encoder failure. The message is the raw tool diagnostic so that it can be
 * stored on the failed rendition as-is.
 */
@Getter
public class EncodeException extends TranscodeException {

    private final int height;

    public EncodeException(int height, String diagnostic) {
        super("ENCODE_ERROR", diagnostic);
        this.height = height;
    }

    public EncodeException(int height, String diagnostic, Throwable cause) {
        super("ENCODE_ERROR", diagnostic, cause);
        this.height = height;
    }
}
