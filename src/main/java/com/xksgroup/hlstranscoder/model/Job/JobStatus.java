package com.xksgroup.hlstranscoder.model.Job;

import java.util.Locale;

public enum JobStatus {
    QUEUED,     // Rows committed, descriptor pushed
    RUNNING,    // A worker holds the descriptor
    DONE,       // At least one rendition ready, master uploaded
    FAILED;     // Setup failure or zero ready renditions

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Value stored in the {@code jobs.status} column.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String value) {
        return JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
