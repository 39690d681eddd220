package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.model.Rendition;

import java.util.List;

public interface RenditionRepository {

    void insertAll(List<Rendition> renditions);

    List<Rendition> findByJobId(String jobId);

    /** queued|running → running. */
    void markRunning(String jobId, int height);

    /** running → ready, storage key, width and codecs written in the same statement. */
    void markReady(String jobId, int height, String key, int width, String codecs);

    /** queued|running → failed. */
    void markFailed(String jobId, int height, String error);
}
