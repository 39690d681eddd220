package com.xksgroup.hlstranscoder.model;

import java.util.Locale;

public enum RenditionStatus {
    QUEUED,
    RUNNING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RenditionStatus fromDb(String value) {
        return RenditionStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
