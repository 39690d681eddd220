package com.xksgroup.hlstranscoder.exception;

import lombok.Getter;

import java.util.Collection;

@Getter
public class InvalidProfileException extends TranscodeException {

    private final int height;

    public InvalidProfileException(int height, Collection<Integer> supported) {
        super("INVALID_PROFILE", "unsupported target height " + height + " (supported: " + supported + ")");
        this.height = height;
    }
}
