package com.xksgroup.hlstranscoder.service.queue;

import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;

import java.time.Duration;
import java.util.Optional;

/**
 * FIFO of transcode job descriptors shared by producers and workers.
 * <p>
 * Without leases a popped descriptor is gone for good (at-most-once). With
 * leases it stays in a processing set until acknowledged, and
 * {@link #requeueExpired()} puts it back at the head once the lease runs out
 * (at-least-once).
 */
public interface WorkQueue {

    /**
     * Append to the tail.
     *
     * @throws com.xksgroup.hlstranscoder.exception.QueueUnavailableException when the backend cannot be reached
     */
    void push(JobDescriptor descriptor);

    /**
     * Blocking pop with timeout. Empty when nothing arrived in time.
     */
    Optional<Delivery> poll(Duration timeout) throws InterruptedException;

    void acknowledge(Delivery delivery);

    /**
     * Push the lease deadline of an in-flight delivery a full lease duration
     * ahead. Long jobs call this between steps so they are not reaped while
     * still making progress.
     *
     * @return false when the lease is gone (acknowledged, already reaped) or leases are off
     */
    boolean extend(Delivery delivery);

    /**
     * @return number of deliveries moved back to the queue
     */
    int requeueExpired();

    long size();

    boolean isLeaseEnabled();
}
