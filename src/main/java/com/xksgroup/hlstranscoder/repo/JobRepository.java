package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.model.Job.Job;

import java.util.Optional;

/**
 * Job rows. Status updates are conditional on the current status and throw
 * {@link com.xksgroup.hlstranscoder.exception.StateConflictException} when the
 * transition is not allowed, or
 * {@link com.xksgroup.hlstranscoder.exception.NotFoundException} when the row
 * is missing.
 */
public interface JobRepository {

    void insert(Job job);

    Optional<Job> findById(String id);

    Optional<Job> findLatestByVideoId(String videoId);

    /**
     * queued → running. With {@code redelivery}, running → running is accepted
     * too, for a descriptor handed out again after an expired lease.
     */
    void markRunning(String id, boolean redelivery);

    /** running → done. */
    void markDone(String id);

    /** queued|running → failed. */
    void markFailed(String id, String error);
}
