package com.xksgroup.hlstranscoder.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancel flag for one job being processed on this instance.
 */
public class CancellationToken {

    private final String jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String jobId) {
        this.jobId = jobId;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }
}
