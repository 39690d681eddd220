package com.xksgroup.hlstranscoder.exception;

/**
 * A status update would break the monotone job or rendition lifecycle.
 */
public class StateConflictException extends TranscodeException {

    public StateConflictException(String message) {
        super("STATE_CONFLICT", message);
    }
}
